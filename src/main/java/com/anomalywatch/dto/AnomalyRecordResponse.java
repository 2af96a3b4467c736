package com.anomalywatch.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class AnomalyRecordResponse {
    UUID   id;
    @JsonFormat(pattern = "yyyy-MM-dd", timezone = "UTC")
    LocalDate date;
    String metricKey;
    String metricName;
    Double actual;
    Double forecast;
    Double lowerBound;
    Double upperBound;
    String status;
    Double deviationPct;
    boolean deviationUndefined;
    String dimensions;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String requestId;
}
