package com.anomalywatch.transform.filter;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import com.anomalywatch.transform.BatchTransformer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Keeps the smallest leading set of rows, by descending value, whose share of the column total
 * reaches the threshold.
 *
 * <p>Rows are stable-sorted descending (ties keep input order) and retained up to and including
 * the first row whose cumulative share is {@code >= threshold}; the output is that prefix of the
 * sorted rows. {@code threshold <= 0} keeps nothing; otherwise a non-positive total leaves the
 * batch unchanged, {@code threshold >= 1} keeps every row. Cells with no value count as zero.</p>
 */
@Getter
public class CumulativeMassFilter implements BatchTransformer {

    private final String valueColumn;
    private final double threshold;

    public CumulativeMassFilter(String valueColumn, double threshold) {
        if (valueColumn == null || valueColumn.isBlank()) {
            throw new InvalidTransformerConfigException("cumulative mass filter needs a value column");
        }
        if (Double.isNaN(threshold)) {
            throw new InvalidTransformerConfigException("cumulative mass threshold must be a number");
        }
        this.valueColumn = valueColumn;
        this.threshold = threshold;
    }

    @Override
    public DataBatch transform(DataBatch batch) {
        if (batch.isEmpty()) {
            return batch;
        }
        batch.requireColumn(valueColumn);
        if (threshold <= 0.0) {
            return batch.withRows(List.of());
        }

        List<Ranked> ranked = new ArrayList<>(batch.size());
        double total = 0.0;
        for (Map<String, Object> row : batch.getRows()) {
            Double value = Cells.toDouble(valueColumn, row.get(valueColumn));
            double v = value != null ? value : 0.0;
            ranked.add(new Ranked(row, v));
            total += v;
        }
        if (total <= 0.0) {
            return batch;
        }

        // List.sort is a stable merge sort
        ranked.sort(Comparator.comparingDouble(Ranked::value).reversed());

        List<Map<String, Object>> kept = new ArrayList<>();
        double cumulative = 0.0;
        for (Ranked r : ranked) {
            kept.add(r.row());
            cumulative += r.value();
            if (threshold < 1.0 && cumulative / total >= threshold) {
                break;
            }
        }
        return batch.withRows(kept);
    }

    @Override
    public String describe() {
        return "CumulativeMassFilter(" + valueColumn + ", threshold=" + threshold + ")";
    }

    private record Ranked(Map<String, Object> row, double value) {}
}
