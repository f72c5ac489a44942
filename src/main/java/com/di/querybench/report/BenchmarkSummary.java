package com.di.querybench.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Value
@Builder
public class BenchmarkSummary {
    /** Strategy name → statistics, in the order strategies were measured. */
    Map<String, LatencyStats> stats;
    /** Every ordered pair of distinct strategies. */
    List<SpeedupRatio>        ratios;

    public double mean(String strategy) {
        LatencyStats s = stats.get(strategy);
        if (s == null) {
            throw new NoSuchElementException("No latencies for strategy " + strategy);
        }
        return s.getMean();
    }

    public double ratio(String numerator, String denominator) {
        return ratios.stream()
                .filter(r -> r.getNumerator().equals(numerator) && r.getDenominator().equals(denominator))
                .mapToDouble(SpeedupRatio::getRatio)
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No ratio " + numerator + " / " + denominator));
    }
}
