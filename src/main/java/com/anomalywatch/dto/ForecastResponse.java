package com.anomalywatch.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ForecastResponse {
    String requestId;
    int    horizon;
    List<String> columns;
    List<Map<String, Object>> rows;
}
