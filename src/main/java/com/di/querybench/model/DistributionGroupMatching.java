package com.di.querybench.model;

import lombok.Value;

@Value
public class DistributionGroupMatching {
    long            id;
    long            distributionGroupId;
    MatchingPointer pointer;

    public MatchingType getType() {
        return pointer.getType();
    }
}
