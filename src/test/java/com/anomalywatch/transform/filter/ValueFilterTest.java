package com.anomalywatch.transform.filter;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.comparison.AnomalyStatus;
import com.anomalywatch.exception.InvalidTransformerConfigException;
import com.anomalywatch.exception.MissingColumnException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ValueFilterTest {

    private final DataBatch results = DataBatch.builder(List.of("metric", "status", "deviation_pct"))
        .row("a", "IN_RANGE", 0.0)
        .row("b", "ABOVE_UPPER", 4.5)
        .row("c", "BELOW_LOWER", 12.0)
        .row("d", "NO_FORECAST", 0.0)
        .build();

    @Test
    void include_keepsListedValues() {
        DataBatch out = ValueFilter.include("status", List.of("ABOVE_UPPER", "BELOW_LOWER")).transform(results);
        assertThat(out.columnValues("metric")).containsExactly("b", "c");
    }

    @Test
    void exclude_dropsListedValues() {
        DataBatch out = ValueFilter.exclude("status", List.of("IN_RANGE", "NO_FORECAST")).transform(results);
        assertThat(out.columnValues("metric")).containsExactly("b", "c");
    }

    @Test
    void enumValues_matchTheirNames() {
        DataBatch out = ValueFilter.include("status", List.of(AnomalyStatus.NO_FORECAST)).transform(results);
        assertThat(out.columnValues("metric")).containsExactly("d");
    }

    @Test
    void numericValues_matchAcrossBoxedTypes() {
        DataBatch batch = DataBatch.builder(List.of("n")).row(1).row(2L).row(3.0).build();
        assertThat(ValueFilter.include("n", List.of(2, 3)).transform(batch).columnValues("n"))
            .containsExactly(2L, 3.0);
    }

    @Test
    void range_isInclusiveAndDropsMissingValues() {
        DataBatch batch = DataBatch.builder(List.of("v")).row(1.0).row(5.0).row(10.0).row((Object) null).build();
        assertThat(ValueFilter.range("v", 5.0, 10.0).transform(batch).columnValues("v"))
            .containsExactly(5.0, 10.0);
        assertThat(ValueFilter.range("v", null, 5.0).transform(batch).columnValues("v"))
            .containsExactly(1.0, 5.0);
    }

    @Test
    void setAndRange_combine() {
        ValueFilter filter = ValueFilter.builder()
            .column("deviation_pct").values(List.of(4.5, 12.0)).minValue(10.0).build();
        assertThat(filter.transform(results).columnValues("metric")).containsExactly("c");
    }

    @Test
    void isIdempotent() {
        ValueFilter filter = ValueFilter.exclude("status", List.of("IN_RANGE"));
        DataBatch once = filter.transform(results);
        assertThat(filter.transform(once)).isEqualTo(once);
    }

    @Test
    void emptyBatch_passesThroughEvenWithoutTheColumn() {
        DataBatch empty = DataBatch.empty(List.of("x"));
        assertThat(ValueFilter.include("status", List.of("a")).transform(empty)).isSameAs(empty);
    }

    @Test
    void missingColumn_throws() {
        assertThatThrownBy(() -> ValueFilter.include("channel", List.of("a")).transform(results))
            .isInstanceOf(MissingColumnException.class);
    }

    @Test
    void invalidConfiguration_isRejected() {
        assertThatThrownBy(() -> ValueFilter.builder().column("v").build())
            .isInstanceOf(InvalidTransformerConfigException.class);
        assertThatThrownBy(() -> ValueFilter.range("v", 10.0, 1.0))
            .isInstanceOf(InvalidTransformerConfigException.class);
    }
}
