package com.di.querybench.load.validation;

import com.di.querybench.schema.SchemaVariant;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/** Outcome of reconciling one schema variant against its load configuration. */
@Value
@Builder
public class VerificationResult {
    SchemaVariant    variant;
    List<TableCheck> checks;

    public boolean isPassed() {
        return checks.stream().allMatch(TableCheck::isPassed);
    }

    public List<TableCheck> failures() {
        return checks.stream().filter(c -> !c.isPassed()).collect(Collectors.toList());
    }

    public String failureSummary() {
        return failures().stream().map(TableCheck::describe).collect(Collectors.joining("; "));
    }
}
