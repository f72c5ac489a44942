package com.di.querybench.web;

import com.di.querybench.config.QueryBenchProperties;
import com.di.querybench.load.DatasetLoader;
import com.di.querybench.load.LoadReport;
import com.di.querybench.report.BenchmarkSummary;
import com.di.querybench.session.BenchmarkSession;
import com.di.querybench.session.SessionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Triggers a dataset reload or a full benchmark session.
 * Both calls are synchronous; a session at production cardinalities can run for minutes.
 */
@RestController
@RequestMapping("/api/benchmark")
@RequiredArgsConstructor
public class BenchmarkController {

    private final DatasetLoader        loader;
    private final BenchmarkSession     session;
    private final QueryBenchProperties properties;

    @PostMapping(value = "/reload", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LoadReport> reload() {
        return ResponseEntity.ok(loader.reload(properties.toLoadConfig()));
    }

    /**
     * @param reload optional; overrides {@code querybench.session.reload-before-benchmark}
     */
    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BenchmarkSummary> run(@RequestParam(required = false) Boolean reload) {
        SessionResult result = reload != null ? session.run(reload) : session.run();
        return ResponseEntity.ok(result.getSummary());
    }
}
