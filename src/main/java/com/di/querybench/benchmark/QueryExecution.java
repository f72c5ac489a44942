package com.di.querybench.benchmark;

import lombok.Value;

import java.util.List;
import java.util.Map;

/** Rows and latency of a single strategy execution. */
@Value
public class QueryExecution {
    List<Map<String, Object>> data;
    int                       count;
    long                      queryTimeMs;
}
