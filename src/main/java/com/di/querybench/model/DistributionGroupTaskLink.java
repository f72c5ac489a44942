package com.di.querybench.model;

import lombok.Value;

@Value
public class DistributionGroupTaskLink {
    long id;
    long distributionGroupId;
    long taskId;
}
