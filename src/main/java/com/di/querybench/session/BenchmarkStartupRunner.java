package com.di.querybench.session;

import com.di.querybench.config.QueryBenchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs a benchmark session at startup when {@code querybench.session.run-on-startup} is true.
 * Otherwise the session is driven over HTTP.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BenchmarkStartupRunner implements ApplicationRunner {

    private final QueryBenchProperties properties;
    private final BenchmarkSession     session;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSession().isRunOnStartup()) {
            log.info("[SESSION] run-on-startup is false; POST /api/benchmark/run to start a session");
            return;
        }
        session.run();
    }
}
