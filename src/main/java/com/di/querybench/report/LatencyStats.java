package com.di.querybench.report;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Arithmetic mean plus order statistics of one latency series, in milliseconds. */
@Value
@Builder
public class LatencyStats {
    int    samples;
    double mean;
    double min;
    double max;
    double p50;
    double p95;

    /**
     * @throws IllegalArgumentException for an empty series
     */
    public static LatencyStats of(List<Double> latenciesMs) {
        if (latenciesMs == null || latenciesMs.isEmpty()) {
            throw new IllegalArgumentException("latency series is empty");
        }
        List<Double> sorted = new ArrayList<>(latenciesMs);
        Collections.sort(sorted);
        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        return LatencyStats.builder()
                .samples(sorted.size())
                .mean(sum / sorted.size())
                .min(sorted.get(0))
                .max(sorted.get(sorted.size() - 1))
                .p50(percentile(sorted, 50))
                .p95(percentile(sorted, 95))
                .build();
    }

    /** Nearest-rank percentile over an ascending list. */
    static double percentile(List<Double> sorted, int pct) {
        int rank = (int) Math.ceil(pct / 100.0 * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }
}
