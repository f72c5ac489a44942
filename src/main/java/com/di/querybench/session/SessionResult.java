package com.di.querybench.session;

import com.di.querybench.benchmark.LatencySeries;
import com.di.querybench.load.LoadReport;
import com.di.querybench.report.BenchmarkSummary;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SessionResult {
    String                     sessionId;
    /** {@code null} when the session benchmarked the existing dataset. */
    LoadReport                 loadReport;
    Map<String, LatencySeries> series;
    BenchmarkSummary           summary;
    String                     renderedSummary;
}
