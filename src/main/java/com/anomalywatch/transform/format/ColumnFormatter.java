package com.anomalywatch.transform.format;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import com.anomalywatch.transform.BatchTransformer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Applies a value function to every cell of the named columns. Other columns are copied as is,
 * named columns missing from the batch are skipped, and {@code null} cells stay {@code null}.
 */
public class ColumnFormatter implements BatchTransformer {

    private final Map<String, Function<Object, Object>> formatters;

    public ColumnFormatter(Map<String, ? extends Function<Object, Object>> formatters) {
        if (formatters == null || formatters.isEmpty()) {
            throw new InvalidTransformerConfigException("formatters map cannot be empty");
        }
        this.formatters = Collections.unmodifiableMap(new LinkedHashMap<>(formatters));
    }

    /**
     * Renders numbers as percentage strings, {@code 15.3 -> "15.3%"}. With {@code multiplyBy100}
     * the value is scaled first, {@code 0.153 -> "15.3%"}.
     */
    public static ColumnFormatter percentage(List<String> columns, int decimalPlaces, boolean multiplyBy100) {
        if (decimalPlaces < 0) {
            throw new InvalidTransformerConfigException("decimalPlaces must be non-negative, got " + decimalPlaces);
        }
        String pattern = "%." + decimalPlaces + "f%%";
        return forColumns(columns, column -> value -> {
            double v = requireNumber(column, value);
            if (Double.isNaN(v)) {
                return value;
            }
            return String.format(Locale.ROOT, pattern, multiplyBy100 ? v * 100.0 : v);
        });
    }

    public static ColumnFormatter percentage(String column, int decimalPlaces) {
        return percentage(List.of(column), decimalPlaces, false);
    }

    /** Rounds numbers half-up to {@code decimalPlaces}; zero places yields whole numbers as {@code Long}. */
    public static ColumnFormatter rounded(List<String> columns, int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new InvalidTransformerConfigException("decimalPlaces must be non-negative, got " + decimalPlaces);
        }
        return forColumns(columns, column -> value -> {
            double v = requireNumber(column, value);
            if (Double.isNaN(v)) {
                return value;
            }
            BigDecimal scaled = BigDecimal.valueOf(v)
                .setScale(decimalPlaces, RoundingMode.HALF_UP);
            return decimalPlaces == 0 ? (Object) scaled.longValue() : (Object) scaled.doubleValue();
        });
    }

    @Override
    public DataBatch transform(DataBatch batch) {
        if (batch.isEmpty()) {
            return batch;
        }
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch.getRows()) {
            Map<String, Object> out = new LinkedHashMap<>(row);
            formatters.forEach((column, fn) -> {
                if (out.containsKey(column) && out.get(column) != null) {
                    out.put(column, fn.apply(out.get(column)));
                }
            });
            rows.add(out);
        }
        return batch.withRows(rows);
    }

    @Override
    public String describe() {
        return "ColumnFormatter(" + formatters.keySet() + ")";
    }

    private static ColumnFormatter forColumns(List<String> columns,
                                              Function<String, Function<Object, Object>> perColumn) {
        if (columns == null || columns.isEmpty()) {
            throw new InvalidTransformerConfigException("formatter needs at least one column");
        }
        Map<String, Function<Object, Object>> formatters = new LinkedHashMap<>();
        for (String column : columns) {
            formatters.put(column, perColumn.apply(column));
        }
        return new ColumnFormatter(formatters);
    }

    private static double requireNumber(String column, Object value) {
        Double number = Cells.toDouble(column, value);
        return number != null ? number : Double.NaN;
    }
}
