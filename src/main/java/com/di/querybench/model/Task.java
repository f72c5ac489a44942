package com.di.querybench.model;

import lombok.Value;

@Value
public class Task {
    long id;
}
