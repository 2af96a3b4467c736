package com.anomalywatch.comparison;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Outcome of comparing one actual value with its forecast interval.
 * {@code deviationUndefined} is set when the violated bound was zero and the percentage
 * could not be computed; {@code deviationPct} is then reported as 0.
 */
@Value
@Builder
public class ComparisonResult {
    LocalDate date;
    String metricKey;
    String metricName;
    double actual;
    Double forecast;
    Double lowerBound;
    Double upperBound;
    AnomalyStatus status;
    double deviationPct;
    boolean deviationUndefined;
    @Singular
    Map<String, String> dimensions;
}
