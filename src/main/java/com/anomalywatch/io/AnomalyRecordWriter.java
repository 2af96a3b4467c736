package com.anomalywatch.io;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.comparison.ResultColumns;
import com.anomalywatch.entity.AnomalyRecord;
import com.anomalywatch.repository.AnomalyRecordRepository;
import com.anomalywatch.workflow.BatchWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists detection result rows. Reads the columns named in {@link ResultColumns}; columns the
 * {@code AFTER_DETECTION} chain dropped are stored as {@code null}, and cells it formatted
 * (e.g. {@code "4.55%"}) are read back as numbers.
 */
@Slf4j
public class AnomalyRecordWriter implements BatchWriter {

    private final AnomalyRecordRepository repository;
    private final String dateColumn;
    private final List<String> dimensionNames;
    private final String requestId;

    public AnomalyRecordWriter(AnomalyRecordRepository repository, String dateColumn,
                               List<String> dimensionNames, String requestId) {
        this.repository = repository;
        this.dateColumn = dateColumn;
        this.dimensionNames = dimensionNames != null ? List.copyOf(dimensionNames) : List.of();
        this.requestId = requestId;
    }

    @Override
    public void write(DataBatch batch) {
        if (batch.isEmpty()) {
            log.info("Nothing to persist | requestId={}", requestId);
            return;
        }
        batch.requireColumns(List.of(ResultColumns.METRIC, ResultColumns.STATUS));
        List<AnomalyRecord> records = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch.getRows()) {
            records.add(toRecord(row));
        }
        repository.saveAll(records);
        log.info("Anomaly records saved | count={} | requestId={}", records.size(), requestId);
    }

    private AnomalyRecord toRecord(Map<String, Object> row) {
        Object deviationUndefined = row.get(ResultColumns.DEVIATION_UNDEFINED);
        return AnomalyRecord.builder()
            .observedDate(Cells.toDate(row.get(dateColumn)))
            .metricKey(String.valueOf(row.get(ResultColumns.METRIC)))
            .metricName(text(row.get(ResultColumns.METRIC_NAME)))
            .actualValue(number(row, ResultColumns.ACTUAL))
            .forecastValue(number(row, ResultColumns.FORECAST))
            .lowerBound(number(row, ResultColumns.LOWER_BOUND))
            .upperBound(number(row, ResultColumns.UPPER_BOUND))
            .status(String.valueOf(row.get(ResultColumns.STATUS)))
            .deviationPct(number(row, ResultColumns.DEVIATION_PCT))
            .deviationUndefined(Boolean.TRUE.equals(deviationUndefined)
                || "true".equalsIgnoreCase(String.valueOf(deviationUndefined)))
            .dimensions(dimensions(row))
            .requestId(requestId)
            .build();
    }

    private String dimensions(Map<String, Object> row) {
        if (dimensionNames.isEmpty()) {
            return null;
        }
        return dimensionNames.stream()
            .filter(row::containsKey)
            .map(name -> name + "=" + row.get(name))
            .collect(Collectors.joining(";"));
    }

    private static String text(Object cell) {
        return cell == null ? null : cell.toString();
    }

    private static Double number(Map<String, Object> row, String column) {
        Object cell = row.get(column);
        if (cell instanceof String s && s.endsWith("%")) {
            return Cells.toDouble(column, s.substring(0, s.length() - 1));
        }
        return Cells.toDouble(column, cell);
    }
}
