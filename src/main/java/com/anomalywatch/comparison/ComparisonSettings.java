package com.anomalywatch.comparison;

import com.anomalywatch.quantile.QuantileIndices;
import com.anomalywatch.quantile.QuantileVector;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ComparisonSettings {

    @Builder.Default
    String dateColumn = "date";

    /** Columns that are not metrics. Empty means just the date column. */
    @Builder.Default
    List<String> excludeColumns = List.of();

    @Builder.Default
    QuantileIndices indices = QuantileIndices.defaults();

    @Builder.Default
    int vectorLength = QuantileVector.DEFAULT_LENGTH;

    @Builder.Default
    List<String> dimensionNames = List.of();

    @Builder.Default
    String separator = MetricDecomposer.DEFAULT_SEPARATOR;

    /** Optional label written to every result row, e.g. {@code sessions}. */
    String metricName;

    public static ComparisonSettings defaults() {
        return ComparisonSettings.builder().build();
    }

    public List<String> effectiveExcludeColumns() {
        return excludeColumns.isEmpty() ? List.of(dateColumn) : excludeColumns;
    }
}
