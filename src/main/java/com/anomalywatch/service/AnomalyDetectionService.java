package com.anomalywatch.service;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.comparison.AnomalyStatus;
import com.anomalywatch.comparison.ComparisonEngine;
import com.anomalywatch.comparison.ComparisonSettings;
import com.anomalywatch.comparison.ResultColumns;
import com.anomalywatch.dto.AnomalyRecordResponse;
import com.anomalywatch.dto.DetectionRequest;
import com.anomalywatch.dto.DetectionResponse;
import com.anomalywatch.entity.AnomalyRecord;
import com.anomalywatch.io.AnomalyRecordWriter;
import com.anomalywatch.io.InMemoryBatchReader;
import com.anomalywatch.quantile.QuantileIndices;
import com.anomalywatch.repository.AnomalyRecordRepository;
import com.anomalywatch.transform.BatchTransformer;
import com.anomalywatch.transform.TransformPipeline;
import com.anomalywatch.workflow.AnomalyDetectionWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyDetectionService {

    private final ComparisonEngine        defaultEngine;
    private final TransformerFactory      transformerFactory;
    private final AnomalyRecordRepository repository;

    @Transactional
    public DetectionResponse detect(DetectionRequest req, String requestId) {
        ComparisonEngine engine = engineFor(req);
        ComparisonSettings settings = engine.getSettings();

        List<BatchTransformer> leading = req.getPivot() != null
            ? List.of(transformerFactory.pivot(req.getPivot()))
            : List.of();
        TransformPipeline pipeline = transformerFactory.pipeline(req.getTransformers(), leading);

        AnomalyDetectionWorkflow workflow = AnomalyDetectionWorkflow.builder()
            .forecastReader(new InMemoryBatchReader(DataBatch.fromRows(req.getForecastRows())))
            .actualReader(new InMemoryBatchReader(DataBatch.fromRows(req.getActualRows())))
            .detector(engine)
            .writer(req.isPersist()
                ? new AnomalyRecordWriter(repository, settings.getDateColumn(), settings.getDimensionNames(), requestId)
                : null)
            .pipeline(pipeline)
            .build();

        DataBatch result = workflow.run();
        Map<String, Long> statusCounts = statusCounts(result);
        long anomalies = statusCounts.entrySet().stream()
            .filter(e -> isAnomaly(e.getKey()))
            .mapToLong(Map.Entry::getValue)
            .sum();
        log.info("Detection complete | results={} | anomalies={} | persisted={} | requestId={}",
                 result.size(), anomalies, req.isPersist(), requestId);

        return DetectionResponse.builder()
            .requestId(requestId)
            .resultCount(result.size())
            .anomalyCount(anomalies)
            .statusCounts(statusCounts)
            .persisted(req.isPersist())
            .columns(result.getColumns())
            .rows(result.getRows())
            .build();
    }

    @Transactional(readOnly = true)
    public Page<AnomalyRecordResponse> getHistory(String metricKey, String status,
                                                  LocalDate fromDate, LocalDate toDate, Pageable pageable) {
        return repository.findHistory(metricKey, status, fromDate, toDate, pageable)
            .map(this::toResponse);
    }

    private ComparisonEngine engineFor(DetectionRequest req) {
        boolean overridden = req.getDateColumn() != null || req.getLowerIndex() != null
            || req.getUpperIndex() != null || req.getPointIndex() != null
            || req.getDimensionNames() != null || req.getSeparator() != null || req.getMetricName() != null;
        if (!overridden) {
            return defaultEngine;
        }
        ComparisonSettings defaults = defaultEngine.getSettings();
        QuantileIndices indices = defaults.getIndices();
        ComparisonSettings.ComparisonSettingsBuilder settings = defaults.toBuilder()
            .indices(new QuantileIndices(
                req.getLowerIndex() != null ? req.getLowerIndex() : indices.getLower(),
                req.getUpperIndex() != null ? req.getUpperIndex() : indices.getUpper(),
                req.getPointIndex() != null ? req.getPointIndex() : indices.getPoint()));
        if (req.getDateColumn() != null) {
            settings.dateColumn(req.getDateColumn());
        }
        if (req.getDimensionNames() != null) {
            settings.dimensionNames(List.copyOf(req.getDimensionNames()));
        }
        if (req.getSeparator() != null) {
            settings.separator(req.getSeparator());
        }
        if (req.getMetricName() != null) {
            settings.metricName(req.getMetricName());
        }
        return new ComparisonEngine(settings.build());
    }

    private static Map<String, Long> statusCounts(DataBatch result) {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (!result.hasColumn(ResultColumns.STATUS)) {
            return counts;
        }
        for (Object status : result.columnValues(ResultColumns.STATUS)) {
            counts.merge(String.valueOf(status), 1L, Long::sum);
        }
        return counts;
    }

    private static boolean isAnomaly(String status) {
        return Arrays.stream(AnomalyStatus.values())
            .anyMatch(s -> s.isAnomaly() && s.name().equals(status));
    }

    private AnomalyRecordResponse toResponse(AnomalyRecord r) {
        return AnomalyRecordResponse.builder()
            .id(r.getId()).date(r.getObservedDate())
            .metricKey(r.getMetricKey()).metricName(r.getMetricName())
            .actual(r.getActualValue()).forecast(r.getForecastValue())
            .lowerBound(r.getLowerBound()).upperBound(r.getUpperBound())
            .status(r.getStatus()).deviationPct(r.getDeviationPct())
            .deviationUndefined(r.isDeviationUndefined())
            .dimensions(r.getDimensions())
            .createdAt(r.getCreatedAt())
            .requestId(r.getRequestId()).build();
    }
}
