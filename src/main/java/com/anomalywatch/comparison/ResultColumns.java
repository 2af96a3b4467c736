package com.anomalywatch.comparison;

/** Column names of the batch produced by {@link ComparisonEngine#detect}. */
public final class ResultColumns {

    public static final String METRIC = "metric";
    public static final String METRIC_NAME = "metric_name";
    public static final String ACTUAL = "actual";
    public static final String FORECAST = "forecast";
    public static final String LOWER_BOUND = "lower_bound";
    public static final String UPPER_BOUND = "upper_bound";
    public static final String STATUS = "status";
    public static final String DEVIATION_PCT = "deviation_pct";
    public static final String DEVIATION_UNDEFINED = "deviation_undefined";

    private ResultColumns() {
    }
}
