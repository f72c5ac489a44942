package com.di.querybench.model;

public enum TranslationType {
    SUBTITLE
}
