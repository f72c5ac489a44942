package com.di.querybench.model;

import lombok.Value;

/**
 * Row of {@code account_skill}. {@code skillCode} is a denormalized copy of the referenced
 * skill's code and must equal it; the dataset is immutable after load, so nothing keeps
 * the copy in sync later.
 */
@Value
public class AccountSkillLink {
    long   accountId;
    long   skillId;
    String skillCode;
}
