package com.anomalywatch.transform.filter;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import com.anomalywatch.transform.BatchTransformer;
import lombok.Builder;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keeps or drops rows by the value of one column: set membership ({@link FilterMode}) and/or an
 * inclusive numeric range where either end may be left open. When both are given, membership is
 * applied first, then the range.
 *
 * <p>Numbers are compared by value, so a set holding {@code 100} matches a cell holding
 * {@code 100.0}. A cell with no value never satisfies a range.</p>
 */
@Getter
public class ValueFilter implements BatchTransformer {

    private final String column;
    private final Set<Object> values;
    private final FilterMode mode;
    private final Double minValue;
    private final Double maxValue;

    @Builder
    public ValueFilter(String column, Collection<?> values, FilterMode mode, Double minValue, Double maxValue) {
        if (column == null || column.isBlank()) {
            throw new InvalidTransformerConfigException("value filter needs a column");
        }
        if (values == null && minValue == null && maxValue == null) {
            throw new InvalidTransformerConfigException(
                "At least one of values, minValue or maxValue must be specified for column '" + column + "'");
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new InvalidTransformerConfigException(
                "minValue " + minValue + " is greater than maxValue " + maxValue);
        }
        this.column = column;
        this.values = values == null ? null : normalizeAll(values);
        this.mode = mode != null ? mode : FilterMode.INCLUDE;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public static ValueFilter include(String column, Collection<?> values) {
        return new ValueFilter(column, values, FilterMode.INCLUDE, null, null);
    }

    public static ValueFilter exclude(String column, Collection<?> values) {
        return new ValueFilter(column, values, FilterMode.EXCLUDE, null, null);
    }

    public static ValueFilter range(String column, Double minValue, Double maxValue) {
        return new ValueFilter(column, null, null, minValue, maxValue);
    }

    @Override
    public DataBatch transform(DataBatch batch) {
        if (batch.isEmpty()) {
            return batch;
        }
        batch.requireColumn(column);
        return batch.filterRows(this::keep);
    }

    private boolean keep(Map<String, Object> row) {
        Object cell = row.get(column);
        if (values != null) {
            boolean member = values.contains(normalize(cell));
            if (member != (mode == FilterMode.INCLUDE)) {
                return false;
            }
        }
        if (minValue == null && maxValue == null) {
            return true;
        }
        Double numeric = Cells.toDouble(column, cell);
        if (numeric == null) {
            return false;
        }
        return (minValue == null || numeric >= minValue)
            && (maxValue == null || numeric <= maxValue);
    }

    private static Set<Object> normalizeAll(Collection<?> raw) {
        Set<Object> normalized = new LinkedHashSet<>();
        for (Object value : raw) {
            normalized.add(normalize(value));
        }
        return Collections.unmodifiableSet(normalized);
    }

    private static Object normalize(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value;
    }

    @Override
    public String describe() {
        return "ValueFilter(" + column + ", mode=" + mode + ", values=" + values
            + ", min=" + minValue + ", max=" + maxValue + ")";
    }
}
