package com.di.querybench.load.generator;

import com.di.querybench.load.EntityRef;
import com.di.querybench.load.EntityType;
import com.di.querybench.load.ReferenceIndex;
import com.di.querybench.model.AccountSkillLink;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Each account gets 1 to {@value #MAX_SKILLS_PER_ACCOUNT} distinct skills. The link copies
 * the skill code from the reference index, so it always equals the stored skill's code.
 */
public class AccountSkillMembershipGenerator implements MembershipGenerator<AccountSkillLink> {

    public static final int MAX_SKILLS_PER_ACCOUNT = 5;

    private final long            accountCount;
    private final List<EntityRef> skills;

    public AccountSkillMembershipGenerator(ReferenceIndex references) {
        this.accountCount = references.count(EntityType.ACCOUNT);
        this.skills       = references.resolve(EntityType.SKILL);
    }

    @Override
    public long accountCount() {
        return accountCount;
    }

    @Override
    public List<AccountSkillLink> generate(long accountIndex, Random random) {
        if (accountIndex < 0 || accountIndex >= accountCount) {
            throw new IndexOutOfBoundsException("account index " + accountIndex + " outside [0, " + accountCount + ")");
        }
        long accountId = accountIndex + 1;
        int n = DistinctSampler.membershipCount(MAX_SKILLS_PER_ACCOUNT, skills.size(), random);
        List<AccountSkillLink> links = new ArrayList<>(n);
        for (int pos : DistinctSampler.sample(skills.size(), n, random)) {
            EntityRef skill = skills.get(pos);
            links.add(new AccountSkillLink(accountId, skill.getId(), skill.getCode()));
        }
        return links;
    }
}
