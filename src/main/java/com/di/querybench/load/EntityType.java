package com.di.querybench.load;

/** Entities whose keys other entities reference. */
public enum EntityType {
    ACCOUNT,
    ACCOUNT_GROUP,
    SKILL,
    TASK,
    DISTRIBUTION_GROUP
}
