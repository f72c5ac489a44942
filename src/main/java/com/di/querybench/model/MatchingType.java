package com.di.querybench.model;

/**
 * Discriminator of a {@link DistributionGroupMatching} pointer. Declaration order is the
 * assignment cycle used by the generator.
 */
public enum MatchingType {
    ACCOUNT_ID,
    ACCOUNT_GROUP_ID,
    SKILL_CODE
}
