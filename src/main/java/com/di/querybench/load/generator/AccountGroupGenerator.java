package com.di.querybench.load.generator;

import com.di.querybench.model.AccountGroup;

public class AccountGroupGenerator implements RowGenerator<AccountGroup> {

    private final long count;

    public AccountGroupGenerator(long count) {
        this.count = count;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public AccountGroup generate(long index) {
        checkIndex(index);
        long id = index + 1;
        return new AccountGroup(id, "Group_" + id);
    }
}
