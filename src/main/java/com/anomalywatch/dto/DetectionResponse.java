package com.anomalywatch.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DetectionResponse {
    String requestId;
    int    resultCount;
    long   anomalyCount;
    Map<String, Long> statusCounts;
    boolean persisted;
    List<String> columns;
    List<Map<String, Object>> rows;
}
