package com.anomalywatch.batch;

import com.anomalywatch.exception.MissingColumnException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable tabular batch: an ordered list of column names and an ordered list of rows.
 *
 * <p>Every row holds exactly the batch's columns, in column order; cells may be {@code null}.
 * Stages never modify a batch they receive, they build a new one. Rows handed out by
 * {@link #getRows()} are unmodifiable views.</p>
 */
@EqualsAndHashCode
@ToString
public final class DataBatch {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private DataBatch(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static DataBatch of(Collection<String> columns, List<? extends Map<String, ?>> rows) {
        List<String> cols = List.copyOf(new LinkedHashSet<>(columns));
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            copied.add(freezeRow(cols, row));
        }
        return new DataBatch(cols, Collections.unmodifiableList(copied));
    }

    /**
     * Builds a batch whose columns are the union of the rows' keys, in first-seen order.
     */
    public static DataBatch fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> cols = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            cols.addAll(row.keySet());
        }
        return of(cols, rows);
    }

    public static DataBatch empty(Collection<String> columns) {
        return of(columns, List.of());
    }

    public static Builder builder(Collection<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getRow(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public void requireColumns(Collection<String> required) {
        List<String> missing = required.stream().filter(c -> !columns.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new MissingColumnException(missing, columns);
        }
    }

    public void requireColumn(String column) {
        requireColumns(List.of(column));
    }

    public List<Object> columnValues(String column) {
        requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return Collections.unmodifiableList(values);
    }

    /** Same columns, new rows. */
    public DataBatch withRows(List<? extends Map<String, ?>> newRows) {
        return of(columns, newRows);
    }

    public DataBatch filterRows(Predicate<Map<String, Object>> keep) {
        return new DataBatch(columns, rows.stream().filter(keep).toList());
    }

    private static Map<String, Object> freezeRow(List<String> cols, Map<String, ?> source) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String col : cols) {
            row.put(col, source.get(col));
        }
        return Collections.unmodifiableMap(row);
    }

    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, ?>> rows = new ArrayList<>();

        private Builder(Collection<String> columns) {
            this.columns = List.copyOf(new LinkedHashSet<>(columns));
        }

        public Builder row(Map<String, ?> row) {
            rows.add(row);
            return this;
        }

        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(
                    "Expected " + columns.size() + " values for columns " + columns + ", got " + values.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        public DataBatch build() {
            return DataBatch.of(columns, rows);
        }
    }
}
