package com.di.querybench.load.validation;

import lombok.Builder;
import lombok.Value;

/** One reconciliation: an actual count against an expected inclusive range. */
@Value
@Builder
public class TableCheck {
    String  name;
    long    expectedMin;
    long    expectedMax;
    long    actual;

    public boolean isPassed() {
        return actual >= expectedMin && actual <= expectedMax;
    }

    public String describe() {
        String expected = expectedMin == expectedMax
                ? String.format("%,d", expectedMin)
                : String.format("%,d..%,d", expectedMin, expectedMax);
        return String.format("%s: expected=%s actual=%,d → %s", name, expected, actual, isPassed() ? "PASS" : "FAIL");
    }
}
