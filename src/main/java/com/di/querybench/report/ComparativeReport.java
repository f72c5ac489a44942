package com.di.querybench.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces raw latency series to means and speedup ratios.
 *
 * <p>Ratios always use the arithmetic mean, matching the "Nx faster" convention of the
 * printed summary. A zero denominator mean yields {@link Double#POSITIVE_INFINITY}.
 */
@Component
public class ComparativeReport {

    private static final String RULE_HEAVY = "=".repeat(80);
    private static final String RULE_LIGHT = "-".repeat(80);

    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param sequencesByStrategy strategy name → latencies in ms; iteration order is kept
     * @throws IllegalArgumentException when there is no strategy or a series is empty
     */
    public BenchmarkSummary summarize(Map<String, List<Double>> sequencesByStrategy) {
        if (sequencesByStrategy == null || sequencesByStrategy.isEmpty()) {
            throw new IllegalArgumentException("No latency series to summarize");
        }
        Map<String, LatencyStats> stats = new LinkedHashMap<>();
        sequencesByStrategy.forEach((name, series) -> {
            try {
                stats.put(name, LatencyStats.of(series));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Strategy " + name + ": " + ex.getMessage(), ex);
            }
        });

        List<SpeedupRatio> ratios = new ArrayList<>();
        for (Map.Entry<String, LatencyStats> a : stats.entrySet()) {
            for (Map.Entry<String, LatencyStats> b : stats.entrySet()) {
                if (!a.getKey().equals(b.getKey())) {
                    ratios.add(new SpeedupRatio(a.getKey(), b.getKey(),
                            a.getValue().getMean() / b.getValue().getMean()));
                }
            }
        }
        return BenchmarkSummary.builder().stats(stats).ratios(ratios).build();
    }

    /**
     * Human-readable summary: averages, then the speedup of each strategy over the next one
     * in measurement order and of the first over the last.
     */
    public String render(BenchmarkSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE_HEAVY).append('\n');
        sb.append("SUMMARY").append('\n');
        sb.append(RULE_HEAVY).append('\n');
        summary.getStats().forEach((name, s) -> sb.append(String.format(
                "%-32s avg: %10.3f ms  (min %.3f, p50 %.3f, p95 %.3f, max %.3f, n=%d)%n",
                name, s.getMean(), s.getMin(), s.getP50(), s.getP95(), s.getMax(), s.getSamples())));
        sb.append(RULE_LIGHT).append('\n');

        List<String> names = new ArrayList<>(summary.getStats().keySet());
        for (int i = 0; i + 1 < names.size(); i++) {
            appendImprovement(sb, "Improvement", summary, names.get(i), names.get(i + 1));
        }
        if (names.size() > 2) {
            appendImprovement(sb, "Total Improvement", summary, names.get(0), names.get(names.size() - 1));
        }
        sb.append(RULE_HEAVY).append('\n');
        return sb.toString();
    }

    public String toJson(BenchmarkSummary summary) {
        try {
            return om.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize benchmark summary", e);
        }
    }

    private static void appendImprovement(StringBuilder sb, String label, BenchmarkSummary summary,
                                          String from, String to) {
        sb.append(String.format("%s (%s → %s): %.2fx faster%n", label, from, to, summary.ratio(from, to)));
    }
}
