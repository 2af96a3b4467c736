package com.anomalywatch.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Inline detection run. Forecast rows are wide (date plus one quantile string per metric key);
 * actual rows are wide too, unless {@link #pivot} is given, in which case they are long rows
 * pivoted in the {@code before} hook ahead of any other {@code before} transformer.
 * Absent settings fall back to the {@code detection.*} defaults.
 */
@Value
@Builder
@Jacksonized
public class DetectionRequest {

    @NotEmpty(message = "forecastRows is required")
    @Size(max = 10000, message = "forecastRows supports up to 10000 rows")
    List<Map<String, Object>> forecastRows;

    @NotEmpty(message = "actualRows is required")
    @Size(max = 100000, message = "actualRows supports up to 100000 rows")
    List<Map<String, Object>> actualRows;

    @Valid
    PivotSpec pivot;

    String dateColumn;

    @Min(value = 0, message = "lowerIndex must be >= 0")
    Integer lowerIndex;

    @Min(value = 0, message = "upperIndex must be >= 0")
    Integer upperIndex;

    @Min(value = 0, message = "pointIndex must be >= 0")
    Integer pointIndex;

    List<String> dimensionNames;

    String separator;

    String metricName;

    /** Hook name ({@code before}, {@code after}, {@code after_detection}) to its steps. */
    Map<String, List<@Valid TransformerSpec>> transformers;

    boolean persist;
}
