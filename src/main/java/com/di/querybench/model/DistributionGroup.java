package com.di.querybench.model;

import lombok.Value;

@Value
public class DistributionGroup {
    long                   id;
    DistributionGroupState state;
}
