package com.di.querybench.load.generator;

import com.di.querybench.load.EntityRef;
import com.di.querybench.load.EntityType;
import com.di.querybench.load.ReferenceIndex;
import com.di.querybench.model.DistributionGroupMatching;
import com.di.querybench.model.MatchingPointer;
import com.di.querybench.model.MatchingType;

import java.util.List;

/**
 * One matching per distribution group. The type cycles with the group id,
 * {@code ACCOUNT_ID, ACCOUNT_GROUP_ID, SKILL_CODE} for ids 1, 2, 3, ..., so the three types
 * split the table evenly. The target is picked by {@code id mod targetCount}, which walks
 * every target even when groups vastly outnumber them.
 */
public class DistributionGroupMatchingGenerator implements RowGenerator<DistributionGroupMatching> {

    private static final MatchingType[] CYCLE = MatchingType.values();

    private final long            count;
    private final long            accountCount;
    private final long            accountGroupCount;
    private final List<EntityRef> skills;

    public DistributionGroupMatchingGenerator(ReferenceIndex references) {
        this.count             = references.count(EntityType.DISTRIBUTION_GROUP);
        this.accountCount      = references.count(EntityType.ACCOUNT);
        this.accountGroupCount = references.count(EntityType.ACCOUNT_GROUP);
        this.skills            = references.resolve(EntityType.SKILL);
    }

    /** Matching type of the distribution group with the given (one-based) id. */
    public static MatchingType typeFor(long distributionGroupId) {
        return CYCLE[(int) ((distributionGroupId - 1) % CYCLE.length)];
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public DistributionGroupMatching generate(long index) {
        checkIndex(index);
        long dgId = index + 1;
        return new DistributionGroupMatching(dgId, dgId, pointerFor(dgId));
    }

    private MatchingPointer pointerFor(long dgId) {
        switch (typeFor(dgId)) {
            case ACCOUNT_ID:
                return MatchingPointer.account(dgId % accountCount + 1);
            case ACCOUNT_GROUP_ID:
                return MatchingPointer.accountGroup(dgId % accountGroupCount + 1);
            default:
                EntityRef skill = skills.get((int) (dgId % skills.size()));
                return MatchingPointer.skillCode(skill.getCode());
        }
    }
}
