package com.di.querybench.model;

import lombok.Value;

/** Row of {@code account_to_account_group}; the link id is assigned by the store. */
@Value
public class AccountGroupLink {
    long accountId;
    long accountGroupId;
}
