package com.anomalywatch.comparison;

import com.anomalywatch.exception.DimensionMismatchException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits a composite metric key such as {@code desktop_organic_homepage} back into named
 * dimension values. Segment count must match the configured names exactly.
 */
public final class MetricDecomposer {

    public static final String DEFAULT_SEPARATOR = "_";

    private final List<String> dimensionNames;
    private final String separator;

    public MetricDecomposer(List<String> dimensionNames, String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        this.dimensionNames = List.copyOf(dimensionNames);
        this.separator = separator;
    }

    public MetricDecomposer(List<String> dimensionNames) {
        this(dimensionNames, DEFAULT_SEPARATOR);
    }

    /**
     * @throws DimensionMismatchException if the key does not split into exactly one segment per name
     */
    public Map<String, String> decompose(String metricKey) {
        String[] segments = metricKey.split(Pattern.quote(separator), -1);
        if (segments.length != dimensionNames.size()) {
            throw new DimensionMismatchException(metricKey, segments.length, dimensionNames);
        }
        Map<String, String> dimensions = new LinkedHashMap<>();
        for (int i = 0; i < segments.length; i++) {
            dimensions.put(dimensionNames.get(i), segments[i]);
        }
        return Collections.unmodifiableMap(dimensions);
    }

    /** Inverse of {@link #decompose}: joins values in dimension order. */
    public static String compose(List<String> values, String separator) {
        return String.join(separator, values);
    }
}
