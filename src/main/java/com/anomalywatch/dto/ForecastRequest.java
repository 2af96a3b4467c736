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

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotEmpty(message = "historyRows is required")
    @Size(max = 100000, message = "historyRows supports up to 100000 rows")
    List<Map<String, Object>> historyRows;

    @Valid
    PivotSpec pivot;

    @Min(value = 1, message = "horizon must be >= 1")
    int horizon;

    Map<String, List<@Valid TransformerSpec>> transformers;
}
