package com.anomalywatch.service;

import com.anomalywatch.dto.PivotSpec;
import com.anomalywatch.dto.TransformerSpec;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import com.anomalywatch.transform.BatchTransformer;
import com.anomalywatch.transform.PivotTransformer;
import com.anomalywatch.transform.TransformHook;
import com.anomalywatch.transform.TransformPipeline;
import com.anomalywatch.transform.filter.CumulativeMassFilter;
import com.anomalywatch.transform.filter.ValueFilter;
import com.anomalywatch.transform.format.ColumnFormatter;
import com.anomalywatch.transform.format.ColumnSelector;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns wire-level transformer specs into pipeline stages. Configuration errors surface here,
 * before any data is loaded.
 */
@Component
public class TransformerFactory {

    /**
     * @param leadingBefore stages placed at the head of the {@code before} chain, e.g. a pivot
     */
    public TransformPipeline pipeline(Map<String, List<TransformerSpec>> specs,
                                      List<? extends BatchTransformer> leadingBefore) {
        TransformPipeline.Builder builder = TransformPipeline.builder();
        if (leadingBefore != null) {
            builder.addAll(TransformHook.BEFORE, leadingBefore);
        }
        if (specs != null) {
            specs.forEach((hookName, hookSpecs) -> {
                TransformHook hook = TransformHook.fromName(hookName);
                if (hookSpecs != null) {
                    builder.addAll(hook, hookSpecs.stream().map(this::create).toList());
                }
            });
        }
        return builder.build();
    }

    public BatchTransformer create(TransformerSpec spec) {
        if (spec == null || spec.getKind() == null) {
            throw new InvalidTransformerConfigException("transformer kind is required");
        }
        return switch (spec.getKind()) {
            case VALUE_FILTER -> ValueFilter.builder()
                .column(spec.getColumn())
                .values(spec.getValues())
                .mode(spec.getMode())
                .minValue(spec.getMinValue())
                .maxValue(spec.getMaxValue())
                .build();
            case CUMULATIVE_MASS -> {
                if (spec.getThreshold() == null) {
                    throw new InvalidTransformerConfigException("CUMULATIVE_MASS needs a threshold");
                }
                yield new CumulativeMassFilter(spec.getColumn(), spec.getThreshold());
            }
            case PERCENTAGE -> ColumnFormatter.percentage(
                requireColumns(spec), spec.getDecimalPlaces(), spec.isMultiplyBy100());
            case ROUND -> ColumnFormatter.rounded(requireColumns(spec), spec.getDecimalPlaces());
            case SELECT_COLUMNS -> new ColumnSelector(requireColumns(spec), spec.getSelectMode());
            case PIVOT -> {
                if (spec.getPivot() == null) {
                    throw new InvalidTransformerConfigException("PIVOT needs a pivot definition");
                }
                yield pivot(spec.getPivot());
            }
        };
    }

    public PivotTransformer pivot(PivotSpec spec) {
        return PivotTransformer.builder()
            .indexColumns(spec.getIndexColumns())
            .dimensionColumns(spec.getDimensionColumns())
            .valueColumn(spec.getValueColumn())
            .separator(spec.getSeparator())
            .fillValue(spec.getFillValue())
            .normalizeLabels(spec.isNormalizeLabels())
            .build();
    }

    private static List<String> requireColumns(TransformerSpec spec) {
        if (spec.getColumns() == null || spec.getColumns().isEmpty()) {
            throw new InvalidTransformerConfigException(spec.getKind() + " needs a non-empty columns list");
        }
        return spec.getColumns();
    }
}
