package com.di.querybench.benchmark;

import lombok.Value;

import java.util.List;

/** Per-run latencies of one strategy, in run order. */
@Value
public class LatencySeries {
    String       strategy;
    /** Milliseconds from dispatch until the last row was materialized. */
    List<Double> latenciesMs;
    /** Rows returned by the first run, kept as a sanity check. */
    int          firstRunRowCount;

    public double mean() {
        return latenciesMs.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }
}
