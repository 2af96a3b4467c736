package com.anomalywatch.io;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.BatchSourceException;
import com.anomalywatch.exception.InvalidDateException;
import com.anomalywatch.transform.TransformHook;
import com.anomalywatch.transform.TransformPipeline;
import com.anomalywatch.workflow.BatchReader;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a headered CSV file. Cells are strings except the date column, parsed to {@link LocalDate},
 * and the declared numeric columns, parsed to {@code Double} (blank means no value).
 */
@Slf4j
public class CsvBatchReader implements BatchReader {

    private static final CsvMapper MAPPER = new CsvMapper();

    private final Path path;
    private final String dateColumn;
    private final Set<String> numericColumns;
    private final TransformPipeline pipeline;

    @Builder
    public CsvBatchReader(Path path, String dateColumn, Set<String> numericColumns, TransformPipeline pipeline) {
        if (path == null) {
            throw new BatchSourceException("CSV path cannot be empty");
        }
        this.path = path.toAbsolutePath();
        this.dateColumn = dateColumn;
        this.numericColumns = numericColumns != null ? Set.copyOf(numericColumns) : Set.of();
        this.pipeline = pipeline != null ? pipeline : TransformPipeline.empty();
    }

    @Override
    public DataBatch load() {
        if (!Files.isReadable(path)) {
            throw new BatchSourceException("CSV file not found or not readable: " + path);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = MAPPER.readerFor(Map.class).with(schema).readValues(path.toFile())) {
            while (it.hasNext()) {
                rows.add(convert(it.next()));
            }
        } catch (IOException ex) {
            throw new BatchSourceException("Failed to read CSV file '" + path + "': " + ex.getMessage(), ex);
        }
        DataBatch batch = DataBatch.fromRows(rows);
        if (dateColumn != null && !batch.isEmpty()) {
            batch.requireColumn(dateColumn);
        }
        log.info("CSV loaded | path={} | rows={} | columns={}", path, batch.size(), batch.getColumns().size());
        return pipeline.apply(TransformHook.AFTER, batch);
    }

    private Map<String, Object> convert(Map<String, String> raw) {
        Map<String, Object> row = new LinkedHashMap<>();
        raw.forEach((column, text) -> {
            if (column.equals(dateColumn)) {
                LocalDate date = parseDate(column, text);
                if (date == null) {
                    throw new BatchSourceException(
                        "Cannot parse '" + text + "' in column '" + column + "' of " + path + " as a date");
                }
                row.put(column, date);
            } else if (numericColumns.contains(column)) {
                row.put(column, Cells.toDouble(column, text));
            } else {
                row.put(column, text);
            }
        });
        return row;
    }

    private LocalDate parseDate(String column, String text) {
        try {
            return Cells.toDate(column, text);
        } catch (InvalidDateException ex) {
            throw new BatchSourceException(
                "Cannot parse '" + text + "' in column '" + column + "' of " + path + " as a date", ex);
        }
    }
}
