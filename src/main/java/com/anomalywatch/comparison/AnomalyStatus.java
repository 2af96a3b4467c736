package com.anomalywatch.comparison;

public enum AnomalyStatus {
    IN_RANGE,
    BELOW_LOWER,
    ABOVE_UPPER,
    NO_FORECAST;

    public boolean isAnomaly() {
        return this == BELOW_LOWER || this == ABOVE_UPPER;
    }
}
