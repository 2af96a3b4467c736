package com.anomalywatch.comparison;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.DuplicateTimePointException;
import com.anomalywatch.exception.InvalidDateException;
import com.anomalywatch.exception.MalformedQuantileException;
import com.anomalywatch.quantile.QuantileIndices;
import com.anomalywatch.quantile.QuantileVector;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins a forecast batch and an actual batch on (date, metric key) and classifies every
 * observed value against its quantile interval.
 *
 * <p>Forecast batch: a date column plus one column per metric key, each cell a pipe-delimited
 * quantile string (or a {@link QuantileVector}). Actual batch: the same date column plus one
 * numeric column per metric key, typically the output of a pivot.</p>
 *
 * <ul>
 *   <li>actual-only keys (or a date with no forecast row) yield {@link AnomalyStatus#NO_FORECAST};</li>
 *   <li>forecast-only keys are skipped;</li>
 *   <li>actual cells holding no observation ({@code null}/{@code NaN}) are skipped.</li>
 * </ul>
 *
 * Instances hold only immutable configuration and are safe to share between threads.
 */
@Slf4j
public class ComparisonEngine implements AnomalyDetector {

    private final ComparisonSettings settings;
    private final QuantileIndices indices;
    private final MetricDecomposer decomposer;

    public ComparisonEngine(ComparisonSettings settings) {
        this.settings = settings;
        this.indices = settings.getIndices().validate(settings.getVectorLength());
        this.decomposer = settings.getDimensionNames().isEmpty()
            ? null
            : new MetricDecomposer(settings.getDimensionNames(), settings.getSeparator());
    }

    public ComparisonSettings getSettings() {
        return settings;
    }

    public List<ComparisonResult> compare(DataBatch forecast, DataBatch actual) {
        if (actual.isEmpty()) {
            return List.of();
        }
        String dateColumn = settings.getDateColumn();
        actual.requireColumn(dateColumn);

        Set<String> excluded = Set.copyOf(settings.effectiveExcludeColumns());
        List<String> metrics = actual.getColumns().stream()
            .filter(c -> !excluded.contains(c))
            .toList();
        Map<String, Map<String, String>> dimensionsByMetric = decomposeAll(metrics);
        Map<LocalDate, Map<String, Object>> forecastByDate = indexByDate(forecast);

        List<ComparisonResult> results = new ArrayList<>();
        for (Map<String, Object> row : actual.getRows()) {
            LocalDate date = requireDate(dateColumn, row);
            Map<String, Object> forecastRow = forecastByDate.get(date);
            for (String metric : metrics) {
                Double observed = Cells.toDouble(metric, row.get(metric));
                if (observed == null) {
                    continue;
                }
                Object cell = forecastRow != null ? forecastRow.get(metric) : null;
                results.add(compareCell(date, metric, observed, cell, dimensionsByMetric.get(metric)));
            }
        }
        log.debug("Comparison finished | actualRows={} | metrics={} | results={}",
                  actual.size(), metrics.size(), results.size());
        return results;
    }

    @Override
    public DataBatch detect(DataBatch forecast, DataBatch actual) {
        return toBatch(compare(forecast, actual));
    }

    public DataBatch toBatch(List<ComparisonResult> results) {
        List<String> columns = resultColumns();
        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        for (ComparisonResult r : results) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(settings.getDateColumn(), r.getDate());
            row.put(ResultColumns.METRIC, r.getMetricKey());
            if (settings.getMetricName() != null) {
                row.put(ResultColumns.METRIC_NAME, r.getMetricName());
            }
            row.put(ResultColumns.ACTUAL, r.getActual());
            row.put(ResultColumns.FORECAST, r.getForecast());
            row.put(ResultColumns.LOWER_BOUND, r.getLowerBound());
            row.put(ResultColumns.UPPER_BOUND, r.getUpperBound());
            row.put(ResultColumns.STATUS, r.getStatus().name());
            row.put(ResultColumns.DEVIATION_PCT, r.getDeviationPct());
            row.put(ResultColumns.DEVIATION_UNDEFINED, r.isDeviationUndefined());
            row.putAll(r.getDimensions());
            rows.add(row);
        }
        return DataBatch.of(columns, rows);
    }

    public List<String> resultColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(settings.getDateColumn());
        columns.add(ResultColumns.METRIC);
        if (settings.getMetricName() != null) {
            columns.add(ResultColumns.METRIC_NAME);
        }
        columns.addAll(List.of(
            ResultColumns.ACTUAL, ResultColumns.FORECAST,
            ResultColumns.LOWER_BOUND, ResultColumns.UPPER_BOUND,
            ResultColumns.STATUS, ResultColumns.DEVIATION_PCT, ResultColumns.DEVIATION_UNDEFINED));
        columns.addAll(settings.getDimensionNames());
        return columns;
    }

    /**
     * Classifies one value against an interval. Bounds are inclusive; deviation is measured
     * from the violated bound and is never negative.
     */
    public static Classification classify(double actual, double lower, double upper) {
        if (actual < lower) {
            return deviation(AnomalyStatus.BELOW_LOWER, lower - actual, lower);
        }
        if (actual > upper) {
            return deviation(AnomalyStatus.ABOVE_UPPER, actual - upper, upper);
        }
        return new Classification(AnomalyStatus.IN_RANGE, 0.0, false);
    }

    private static Classification deviation(AnomalyStatus status, double distance, double bound) {
        if (bound == 0.0) {
            return new Classification(status, 0.0, true);
        }
        return new Classification(status, Math.abs(distance / bound * 100.0), false);
    }

    private ComparisonResult compareCell(LocalDate date, String metric, double observed,
                                         Object cell, Map<String, String> dimensions) {
        ComparisonResult.ComparisonResultBuilder result = ComparisonResult.builder()
            .date(date)
            .metricKey(metric)
            .metricName(settings.getMetricName())
            .actual(observed);
        if (dimensions != null) {
            result.dimensions(dimensions);
        }

        QuantileVector vector = toVector(cell);
        if (vector == null) {
            return result.status(AnomalyStatus.NO_FORECAST).deviationPct(0.0).build();
        }

        double lower = vector.get(indices.getLower());
        double upper = vector.get(indices.getUpper());
        result.forecast(vector.get(indices.getPoint()))
            .lowerBound(lower)
            .upperBound(upper);
        if (vector.isNoForecast(indices)) {
            return result.status(AnomalyStatus.NO_FORECAST).deviationPct(0.0).build();
        }

        Classification c = classify(observed, lower, upper);
        return result.status(c.status())
            .deviationPct(c.deviationPct())
            .deviationUndefined(c.deviationUndefined())
            .build();
    }

    private QuantileVector toVector(Object cell) {
        if (Cells.isMissing(cell)) {
            return null;
        }
        if (cell instanceof QuantileVector vector) {
            if (vector.length() != settings.getVectorLength()) {
                throw new MalformedQuantileException(vector.encode(),
                    "expected " + settings.getVectorLength() + " values, got " + vector.length());
            }
            return vector;
        }
        String text = cell.toString();
        if (text.isBlank()) {
            return null;
        }
        return QuantileVector.parse(text, settings.getVectorLength());
    }

    private Map<String, Map<String, String>> decomposeAll(List<String> metrics) {
        Map<String, Map<String, String>> byMetric = new HashMap<>();
        if (decomposer == null) {
            return byMetric;
        }
        for (String metric : metrics) {
            byMetric.put(metric, decomposer.decompose(metric));
        }
        return byMetric;
    }

    private Map<LocalDate, Map<String, Object>> indexByDate(DataBatch forecast) {
        Map<LocalDate, Map<String, Object>> byDate = new HashMap<>();
        if (forecast.isEmpty()) {
            return byDate;
        }
        forecast.requireColumn(settings.getDateColumn());
        for (Map<String, Object> row : forecast.getRows()) {
            LocalDate date = requireDate(settings.getDateColumn(), row);
            if (byDate.putIfAbsent(date, row) != null) {
                throw new DuplicateTimePointException("Forecast", date);
            }
        }
        return byDate;
    }

    private static LocalDate requireDate(String dateColumn, Map<String, Object> row) {
        LocalDate date = Cells.toDate(dateColumn, row.get(dateColumn));
        if (date == null) {
            throw new InvalidDateException(dateColumn, null);
        }
        return date;
    }

    public record Classification(AnomalyStatus status, double deviationPct, boolean deviationUndefined) {}
}
