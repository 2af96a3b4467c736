package com.anomalywatch.transform;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.comparison.MetricDecomposer;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Long-to-wide pivot. One output row per distinct index tuple, one column per distinct metric
 * key, both in first-appearance order. The metric key is the dimension values joined with the
 * separator, so {@link MetricDecomposer} can split it again.
 *
 * <p>Duplicate (index, key) cells are summed. Combinations never observed get {@code fillValue},
 * {@code NaN} by default, so "observed zero" stays distinguishable from "no observation".
 * Rows whose value is {@code null} or {@code NaN} are not observations.</p>
 */
@Getter
public class PivotTransformer implements BatchTransformer {

    private static final Pattern LABEL_NOISE = Pattern.compile("[().\\-_\\s]");

    private final List<String> indexColumns;
    private final List<String> dimensionColumns;
    private final String valueColumn;
    private final String separator;
    private final Double fillValue;
    private final boolean normalizeLabels;

    @Builder
    public PivotTransformer(List<String> indexColumns, List<String> dimensionColumns, String valueColumn,
                            String separator, Double fillValue, boolean normalizeLabels) {
        if (indexColumns == null || indexColumns.isEmpty()) {
            throw new InvalidTransformerConfigException("pivot needs at least one index column");
        }
        if (dimensionColumns == null || dimensionColumns.isEmpty()) {
            throw new InvalidTransformerConfigException("pivot needs at least one dimension column");
        }
        if (valueColumn == null || valueColumn.isBlank()) {
            throw new InvalidTransformerConfigException("pivot needs a value column");
        }
        this.indexColumns = List.copyOf(indexColumns);
        this.dimensionColumns = List.copyOf(dimensionColumns);
        this.valueColumn = valueColumn;
        this.separator = separator != null ? separator : MetricDecomposer.DEFAULT_SEPARATOR;
        this.fillValue = fillValue != null ? fillValue : Double.NaN;
        this.normalizeLabels = normalizeLabels;
    }

    public PivotTransformer(String indexColumn, List<String> dimensionColumns, String valueColumn) {
        this(List.of(indexColumn), dimensionColumns, valueColumn, null, null, false);
    }

    @Override
    public DataBatch transform(DataBatch batch) {
        if (batch.isEmpty()) {
            return DataBatch.empty(indexColumns);
        }
        List<String> required = new ArrayList<>(indexColumns);
        required.addAll(dimensionColumns);
        required.add(valueColumn);
        batch.requireColumns(required);

        Map<List<Object>, Map<String, Double>> cells = new LinkedHashMap<>();
        Set<String> metricKeys = new LinkedHashSet<>();
        for (Map<String, Object> row : batch.getRows()) {
            List<Object> index = new ArrayList<>(indexColumns.size());
            for (String col : indexColumns) {
                index.add(row.get(col));
            }
            String key = metricKey(row);
            metricKeys.add(key);
            Map<String, Double> wide = cells.computeIfAbsent(index, i -> new LinkedHashMap<>());
            Double value = Cells.toDouble(valueColumn, row.get(valueColumn));
            if (value != null) {
                wide.merge(key, value, Double::sum);
            }
        }

        List<String> columns = new ArrayList<>(indexColumns);
        columns.addAll(metricKeys);
        List<Map<String, Object>> rows = new ArrayList<>(cells.size());
        cells.forEach((index, wide) -> {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < indexColumns.size(); i++) {
                out.put(indexColumns.get(i), index.get(i));
            }
            for (String key : metricKeys) {
                out.put(key, wide.getOrDefault(key, fillValue));
            }
            rows.add(out);
        });
        return DataBatch.of(columns, rows);
    }

    private String metricKey(Map<String, Object> row) {
        List<String> parts = new ArrayList<>(dimensionColumns.size());
        for (String col : dimensionColumns) {
            Object cell = row.get(col);
            String label = String.valueOf(cell);
            if (normalizeLabels) {
                label = LABEL_NOISE.matcher(label.toLowerCase(Locale.ROOT)).replaceAll("");
            }
            parts.add(label);
        }
        return MetricDecomposer.compose(parts, separator);
    }

    @Override
    public String describe() {
        return "Pivot(" + indexColumns + " x " + dimensionColumns + " -> " + valueColumn + ")";
    }
}
