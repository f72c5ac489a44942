package com.di.querybench.web;

import com.di.querybench.benchmark.BenchmarkRunner;
import com.di.querybench.benchmark.QueryExecution;
import com.di.querybench.benchmark.QueryStrategy;
import com.di.querybench.config.QueryBenchProperties;
import com.di.querybench.load.DatasetGuard;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * Serves one page of waiting distribution groups through the configured slow and fast
 * strategies, for driving load against the two access patterns over HTTP. Queries wait for
 * a running reload to finish.
 */
@RestController
@RequestMapping("/api/distribution-groups")
@RequiredArgsConstructor
@Validated
public class DistributionGroupController {

    private final BenchmarkRunner      runner;
    private final QueryBenchProperties properties;
    private final JdbcTemplate         jdbc;
    private final DatasetGuard         guard;

    @GetMapping(value = "/slow", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryExecution> slow(
            @RequestParam(defaultValue = "100") @PositiveOrZero int limit,
            @RequestParam(defaultValue = "0") @PositiveOrZero int offset) {
        return ResponseEntity.ok(execute(properties.getBenchmark().getSlowStrategy(), limit, offset));
    }

    @GetMapping(value = "/fast", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryExecution> fast(
            @RequestParam(defaultValue = "100") @PositiveOrZero int limit,
            @RequestParam(defaultValue = "0") @PositiveOrZero int offset) {
        return ResponseEntity.ok(execute(properties.getBenchmark().getFastStrategy(), limit, offset));
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> health() {
        long start = System.currentTimeMillis();
        Integer one = jdbc.queryForObject("SELECT 1", Integer.class);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("dbCheck", one != null && one == 1);
        body.put("responseTimeMs", System.currentTimeMillis() - start);
        return ResponseEntity.ok(body);
    }

    private QueryExecution execute(String strategyName, int limit, int offset) {
        QueryStrategy strategy = QueryStrategy.parse(strategyName);
        Lock lock = guard.benchmarkLock();
        lock.lock();
        try {
            return runner.executeOnce(strategy, limit, offset);
        } finally {
            lock.unlock();
        }
    }
}
