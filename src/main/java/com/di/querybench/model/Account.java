package com.di.querybench.model;

import lombok.Value;

@Value
public class Account {
    long   id;
    String name;
}
