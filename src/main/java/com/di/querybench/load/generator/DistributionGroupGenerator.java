package com.di.querybench.load.generator;

import com.di.querybench.model.DistributionGroup;
import com.di.querybench.model.DistributionGroupState;

/** Every generated distribution group starts out {@link DistributionGroupState#WAITING}. */
public class DistributionGroupGenerator implements RowGenerator<DistributionGroup> {

    private final long count;

    public DistributionGroupGenerator(long count) {
        this.count = count;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public DistributionGroup generate(long index) {
        checkIndex(index);
        return new DistributionGroup(index + 1, DistributionGroupState.WAITING);
    }
}
