package com.di.querybench.benchmark;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes query strategies against an already loaded dataset and records wall-clock
 * latency per run.
 *
 * <p>A run is timed from just before dispatch until {@code queryForList} returns, i.e.
 * network, execution and materialization of every row on the client. Runs are independent
 * and sequential. There is no warm-up phase: the first run is measured like the others.
 */
@Service
@Slf4j
public class BenchmarkRunner {

    private final JdbcTemplate jdbc;
    private final String       idCastType;

    public BenchmarkRunner(JdbcTemplate jdbc,
                           @Value("${querybench.benchmark.id-cast-type:" + QueryShape.DEFAULT_ID_CAST_TYPE + "}") String idCastType) {
        this.jdbc       = jdbc;
        this.idCastType = idCastType;
    }

    /**
     * Runs {@code strategy} {@code iterations} times.
     *
     * @throws IllegalArgumentException for negative page size or offset, or fewer than one iteration
     * @throws org.springframework.dao.DataAccessException when a run fails; the benchmark of this strategy is aborted
     */
    public LatencySeries measure(QueryStrategy strategy, int pageSize, int offset, int iterations) {
        validatePaging(pageSize, offset);
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1 (was " + iterations + ")");
        }

        String sql = strategy.sql(idCastType);
        log.info("[BENCH] {} pageSize={} offset={} iterations={}", strategy.getName(), pageSize, offset, iterations);
        log.debug("[BENCH] {} SQL:\n{}", strategy.getName(), sql);

        List<Double> latencies = new ArrayList<>(iterations);
        int firstRunRows = -1;
        for (int i = 0; i < iterations; i++) {
            long start = System.nanoTime();
            List<Map<String, Object>> rows = jdbc.queryForList(sql, pageSize, offset);
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            latencies.add(elapsedMs);
            if (i == 0) {
                firstRunRows = rows.size();
                log.info("[BENCH] {} result count: {}", strategy.getName(), firstRunRows);
                if (firstRunRows > pageSize) {
                    log.warn("[BENCH] {} returned {} rows for page size {}", strategy.getName(), firstRunRows, pageSize);
                }
            }
            log.debug("[BENCH] {} run {}/{}: {} ms", strategy.getName(), i + 1, iterations, String.format("%.3f", elapsedMs));
        }

        LatencySeries series = new LatencySeries(strategy.getName(), List.copyOf(latencies), firstRunRows);
        log.info("[BENCH] {} execution times: {} ms, average: {} ms",
                 strategy.getName(), formatAll(latencies), String.format("%.3f", series.mean()));
        return series;
    }

    /** Measures strategies one after another; results keyed by strategy name in input order. */
    public Map<String, LatencySeries> measureAll(List<QueryStrategy> strategies, int pageSize, int offset, int iterations) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one query strategy is required");
        }
        Map<String, LatencySeries> out = new LinkedHashMap<>();
        for (QueryStrategy strategy : strategies) {
            if (out.containsKey(strategy.getName())) {
                throw new IllegalArgumentException("Duplicate query strategy: " + strategy.getName());
            }
            out.put(strategy.getName(), measure(strategy, pageSize, offset, iterations));
        }
        return out;
    }

    /** Executes {@code strategy} once and returns its rows; used by the HTTP endpoints. */
    public QueryExecution executeOnce(QueryStrategy strategy, int pageSize, int offset) {
        validatePaging(pageSize, offset);
        long start = System.currentTimeMillis();
        List<Map<String, Object>> rows = jdbc.queryForList(strategy.sql(idCastType), pageSize, offset);
        long elapsed = System.currentTimeMillis() - start;
        return new QueryExecution(rows, rows.size(), elapsed);
    }

    private static void validatePaging(int pageSize, int offset) {
        if (pageSize < 0) {
            throw new IllegalArgumentException("pageSize must be >= 0 (was " + pageSize + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ")");
        }
    }

    private static String formatAll(List<Double> values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.1f", values.get(i)));
        }
        return sb.append(']').toString();
    }
}
