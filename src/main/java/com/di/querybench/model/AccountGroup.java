package com.di.querybench.model;

import lombok.Value;

@Value
public class AccountGroup {
    long   id;
    String name;
}
