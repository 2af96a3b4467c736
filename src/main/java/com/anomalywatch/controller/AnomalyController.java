package com.anomalywatch.controller;

import com.anomalywatch.client.ForecastModelClient;
import com.anomalywatch.dto.AnomalyRecordResponse;
import com.anomalywatch.dto.DetectionRequest;
import com.anomalywatch.dto.DetectionResponse;
import com.anomalywatch.dto.ForecastRequest;
import com.anomalywatch.dto.ForecastResponse;
import com.anomalywatch.service.AnomalyDetectionService;
import com.anomalywatch.service.ForecastService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final ForecastService         forecastService;
    private final ForecastModelClient     forecastModelClient;

    @PostMapping("/detections")
    public ResponseEntity<DetectionResponse> detect(
            @Valid @RequestBody DetectionRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /detections | forecastRows={} | actualRows={} | persist={} | requestId={}",
                 request.getForecastRows().size(), request.getActualRows().size(), request.isPersist(), requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(detectionService.detect(request, requestId));
    }

    @GetMapping("/detections/history")
    public ResponseEntity<Page<AnomalyRecordResponse>> history(
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(detectionService.getHistory(metric, status, fromDate, toDate,
            PageRequest.of(page, size, Sort.by("observedDate", "metricKey"))));
    }

    @PostMapping("/forecasts")
    public ResponseEntity<ForecastResponse> forecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts | historyRows={} | horizon={} | requestId={}",
                 request.getHistoryRows().size(), request.getHorizon(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(forecastService.forecast(request, requestId));
    }

    @GetMapping("/model/health")
    public Mono<ResponseEntity<Map<String, Object>>> modelHealth() {
        return forecastModelClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of("forecastModel", healthy ? "UP" : "DOWN",
                                               "status", healthy ? "ok" : "degraded");
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }

    @GetMapping("/model/info")
    public Mono<ResponseEntity<Map<String, Object>>> modelInfo() {
        return forecastModelClient.getModelInfo().map(ResponseEntity::ok);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
