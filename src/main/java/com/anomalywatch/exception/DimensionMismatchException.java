package com.anomalywatch.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class DimensionMismatchException extends AnomalyWatchException {
    private final String metricKey;

    public DimensionMismatchException(String metricKey, int segments, List<String> dimensionNames) {
        super("DIMENSION_MISMATCH",
              "Metric key '" + metricKey + "' has " + segments + " segment(s) but "
              + dimensionNames.size() + " dimension name(s) are configured: " + dimensionNames);
        this.metricKey = metricKey;
    }
}
