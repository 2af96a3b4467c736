package com.anomalywatch.dto;

import com.anomalywatch.transform.filter.FilterMode;
import com.anomalywatch.transform.format.ColumnSelector;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One pipeline step as sent over the wire. Which fields apply depends on {@link #kind}.
 */
@Value
@Builder
@Jacksonized
public class TransformerSpec {

    public enum Kind { VALUE_FILTER, CUMULATIVE_MASS, PERCENTAGE, ROUND, SELECT_COLUMNS, PIVOT }

    @NotNull(message = "kind is required")
    Kind kind;

    /** VALUE_FILTER, CUMULATIVE_MASS */
    String column;

    /** PERCENTAGE, ROUND, SELECT_COLUMNS */
    List<String> columns;

    /** VALUE_FILTER */
    List<Object> values;
    FilterMode mode;
    Double minValue;
    Double maxValue;

    /** CUMULATIVE_MASS */
    Double threshold;

    /** PERCENTAGE, ROUND */
    @Min(value = 0, message = "decimalPlaces must be >= 0")
    @Max(value = 10, message = "decimalPlaces must be <= 10")
    @Builder.Default
    int decimalPlaces = 2;

    /** PERCENTAGE */
    boolean multiplyBy100;

    /** SELECT_COLUMNS */
    ColumnSelector.Mode selectMode;

    /** PIVOT */
    @Valid
    PivotSpec pivot;
}
