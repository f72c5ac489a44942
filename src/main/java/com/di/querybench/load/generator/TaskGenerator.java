package com.di.querybench.load.generator;

import com.di.querybench.model.Task;

public class TaskGenerator implements RowGenerator<Task> {

    private final long count;

    public TaskGenerator(long count) {
        this.count = count;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public Task generate(long index) {
        checkIndex(index);
        return new Task(index + 1);
    }
}
