package com.di.querybench.load.generator;

import com.di.querybench.load.EntityType;
import com.di.querybench.load.ReferenceIndex;
import com.di.querybench.model.DistributionGroupTaskLink;

/** Links distribution group {@code i} to task {@code i}. */
public class DistributionGroupTaskLinkGenerator implements RowGenerator<DistributionGroupTaskLink> {

    private final long count;

    public DistributionGroupTaskLinkGenerator(ReferenceIndex references) {
        long groups = references.count(EntityType.DISTRIBUTION_GROUP);
        long tasks  = references.count(EntityType.TASK);
        if (groups != tasks) {
            throw new IllegalStateException("1:1 task link needs equal counts, got "
                    + groups + " distribution groups and " + tasks + " tasks");
        }
        this.count = groups;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public DistributionGroupTaskLink generate(long index) {
        checkIndex(index);
        long id = index + 1;
        return new DistributionGroupTaskLink(id, id, id);
    }
}
