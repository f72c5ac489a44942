package com.di.querybench.session;

import com.di.querybench.benchmark.BenchmarkRunner;
import com.di.querybench.benchmark.LatencySeries;
import com.di.querybench.benchmark.QueryStrategy;
import com.di.querybench.config.QueryBenchProperties;
import com.di.querybench.load.DatasetGuard;
import com.di.querybench.load.DatasetLoader;
import com.di.querybench.load.LoadConfig;
import com.di.querybench.load.LoadReport;
import com.di.querybench.load.validation.DatasetVerifier;
import com.di.querybench.report.BenchmarkSummary;
import com.di.querybench.report.ComparativeReport;
import com.di.querybench.schema.SchemaVariant;
import com.di.querybench.util.ConnectionPoolLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * One end-to-end experiment: (optional) reload, verification, measurement of every configured
 * strategy, comparison.
 *
 * <p>The dataset is verified for every schema variant a strategy targets before anything is
 * measured, so a partially loaded dataset is never benchmarked. Measurement holds the
 * benchmark lock of {@link DatasetGuard}; a concurrent reload waits until it is done.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BenchmarkSession {

    private final QueryBenchProperties properties;
    private final DatasetLoader        loader;
    private final DatasetVerifier      verifier;
    private final BenchmarkRunner      runner;
    private final ComparativeReport    report;
    private final DatasetGuard         guard;
    private final DataSource           dataSource;

    public SessionResult run() {
        return run(properties.getSession().isReloadBeforeBenchmark());
    }

    public SessionResult run(boolean reload) {
        String sessionId = UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("runId", sessionId)) {
            LoadConfig          config     = properties.toLoadConfig();
            List<QueryStrategy> strategies = properties.benchmarkStrategies();
            QueryBenchProperties.Benchmark bench = properties.getBenchmark();

            log.info("[SESSION] sessionId={} reload={} strategies={}", sessionId, reload,
                     strategies.stream().map(QueryStrategy::getName).toList());

            LoadReport loadReport = reload ? loader.reload(config) : null;

            Map<String, LatencySeries> series;
            Lock lock = guard.benchmarkLock();
            lock.lock();
            try {
                for (SchemaVariant variant : targetedVariants(strategies)) {
                    verifier.requireComplete(config, variant);
                }
                ConnectionPoolLogger.logSectionStart("benchmark " + sessionId);
                ConnectionPoolLogger.logPoolStats(dataSource, "before benchmark");
                series = runner.measureAll(strategies, bench.getPageSize(), bench.getOffset(),
                                           bench.getIterationsPerStrategy());
                ConnectionPoolLogger.logPoolStats(dataSource, "after benchmark");
            } finally {
                lock.unlock();
            }

            Map<String, List<Double>> latencies = new LinkedHashMap<>();
            series.forEach((name, s) -> latencies.put(name, s.getLatenciesMs()));
            BenchmarkSummary summary  = report.summarize(latencies);
            String           rendered = report.render(summary);
            String           json     = report.toJson(summary);

            log.info("[REPORT]\n{}", rendered);
            log.info("[REPORT] structured summary:\n{}", json);
            writeSummaryFile(bench.getSummaryFile(), json);

            return SessionResult.builder()
                    .sessionId(sessionId)
                    .loadReport(loadReport)
                    .series(series)
                    .summary(summary)
                    .renderedSummary(rendered)
                    .build();
        }
    }

    private static Set<SchemaVariant> targetedVariants(List<QueryStrategy> strategies) {
        Set<SchemaVariant> variants = new LinkedHashSet<>();
        for (QueryStrategy s : strategies) {
            variants.add(s.getVariant());
        }
        return variants;
    }

    private static void writeSummaryFile(String file, String json) {
        if (file == null || file.isBlank()) {
            return;
        }
        Path path = Path.of(file);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, json, StandardCharsets.UTF_8);
            log.info("[REPORT] summary saved to {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write benchmark summary to " + path, e);
        }
    }
}
