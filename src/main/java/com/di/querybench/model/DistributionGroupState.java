package com.di.querybench.model;

public enum DistributionGroupState {
    WAITING,
    ASSIGNED,
    DONE
}
