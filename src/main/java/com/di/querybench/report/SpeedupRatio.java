package com.di.querybench.report;

import lombok.Value;

/** {@code mean(numerator) / mean(denominator)}: how many times faster the denominator is. */
@Value
public class SpeedupRatio {
    String numerator;
    String denominator;
    double ratio;
}
