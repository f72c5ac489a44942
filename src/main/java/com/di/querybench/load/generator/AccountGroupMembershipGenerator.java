package com.di.querybench.load.generator;

import com.di.querybench.load.EntityRef;
import com.di.querybench.load.EntityType;
import com.di.querybench.load.ReferenceIndex;
import com.di.querybench.model.AccountGroupLink;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Each account joins 1 to {@value #MAX_GROUPS_PER_ACCOUNT} distinct groups. */
public class AccountGroupMembershipGenerator implements MembershipGenerator<AccountGroupLink> {

    public static final int MAX_GROUPS_PER_ACCOUNT = 3;

    private final long            accountCount;
    private final List<EntityRef> groups;

    public AccountGroupMembershipGenerator(ReferenceIndex references) {
        this.accountCount = references.count(EntityType.ACCOUNT);
        this.groups       = references.resolve(EntityType.ACCOUNT_GROUP);
    }

    @Override
    public long accountCount() {
        return accountCount;
    }

    @Override
    public List<AccountGroupLink> generate(long accountIndex, Random random) {
        if (accountIndex < 0 || accountIndex >= accountCount) {
            throw new IndexOutOfBoundsException("account index " + accountIndex + " outside [0, " + accountCount + ")");
        }
        long accountId = accountIndex + 1;
        int n = DistinctSampler.membershipCount(MAX_GROUPS_PER_ACCOUNT, groups.size(), random);
        List<AccountGroupLink> links = new ArrayList<>(n);
        for (int pos : DistinctSampler.sample(groups.size(), n, random)) {
            links.add(new AccountGroupLink(accountId, groups.get(pos).getId()));
        }
        return links;
    }
}
