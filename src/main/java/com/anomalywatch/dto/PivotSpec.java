package com.anomalywatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** Long-to-wide reshaping of request rows before they reach the engine or the model. */
@Value
@Builder
@Jacksonized
public class PivotSpec {

    @NotEmpty(message = "indexColumns is required")
    List<@NotBlank String> indexColumns;

    @NotEmpty(message = "dimensionColumns is required")
    List<@NotBlank String> dimensionColumns;

    @NotBlank(message = "valueColumn is required")
    String valueColumn;

    String separator;

    Double fillValue;

    boolean normalizeLabels;
}
