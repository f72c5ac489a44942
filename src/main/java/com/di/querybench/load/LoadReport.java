package com.di.querybench.load;

import com.di.querybench.schema.SchemaVariant;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Outcome of a completed reload. */
@Value
@Builder
public class LoadReport {
    String              runId;
    long                seed;
    List<SchemaVariant> variants;
    /** Rows written per physical table, in write order. */
    Map<String, Long>   rowsWritten;
    long                elapsedMs;

    public long totalRows() {
        return rowsWritten.values().stream().mapToLong(Long::longValue).sum();
    }
}
