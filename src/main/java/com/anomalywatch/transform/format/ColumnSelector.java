package com.anomalywatch.transform.format;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import com.anomalywatch.transform.BatchTransformer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps only, or drops, the named columns. Names absent from the batch are ignored.
 */
public class ColumnSelector implements BatchTransformer {

    public enum Mode { KEEP, DROP }

    private final Set<String> columns;
    private final Mode mode;

    public ColumnSelector(List<String> columns, Mode mode) {
        if (columns == null || columns.isEmpty()) {
            throw new InvalidTransformerConfigException("columns list cannot be empty");
        }
        this.columns = new LinkedHashSet<>(columns);
        this.mode = mode != null ? mode : Mode.DROP;
    }

    @Override
    public DataBatch transform(DataBatch batch) {
        List<String> selected = mode == Mode.KEEP
            ? columns.stream().filter(batch::hasColumn).toList()
            : batch.getColumns().stream().filter(c -> !columns.contains(c)).toList();
        return DataBatch.of(selected, batch.getRows());
    }

    @Override
    public String describe() {
        return "ColumnSelector(" + mode + " " + columns + ")";
    }
}
