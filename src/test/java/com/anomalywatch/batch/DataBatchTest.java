package com.anomalywatch.batch;

import com.anomalywatch.exception.InvalidDateException;
import com.anomalywatch.exception.MissingColumnException;
import com.anomalywatch.exception.NonNumericValueException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DataBatchTest {

    @Test
    void of_fillsAbsentCellsWithNullAndDropsUnknownKeys() {
        Map<String, Object> row = new HashMap<>();
        row.put("a", 1);
        row.put("extra", 2);
        DataBatch batch = DataBatch.of(List.of("a", "b"), List.of(row));
        assertThat(batch.getRow(0)).containsOnlyKeys("a", "b").containsEntry("b", null);
    }

    @Test
    void rows_areImmutableAndDetachedFromSource() {
        Map<String, Object> row = new HashMap<>(Map.of("a", 1));
        DataBatch batch = DataBatch.fromRows(List.of(row));
        row.put("a", 99);
        assertThat(batch.getRow(0)).containsEntry("a", 1);
        assertThatThrownBy(() -> batch.getRow(0).put("a", 2)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void requireColumns_reportsEveryMissingName() {
        DataBatch batch = DataBatch.empty(List.of("date"));
        assertThatThrownBy(() -> batch.requireColumns(List.of("date", "x", "y")))
            .isInstanceOf(MissingColumnException.class)
            .hasMessageContaining("[x, y]");
    }

    @Test
    void builder_rejectsWrongArity() {
        assertThatThrownBy(() -> DataBatch.builder(List.of("a", "b")).row(1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cells_toDouble_treatsBlankAndNaNAsMissing() {
        assertThat(Cells.toDouble("c", " ")).isNull();
        assertThat(Cells.toDouble("c", Double.NaN)).isNull();
        assertThat(Cells.toDouble("c", "2.5")).isEqualTo(2.5);
        assertThat(Cells.toDouble("c", 3L)).isEqualTo(3.0);
        assertThatThrownBy(() -> Cells.toDouble("c", "abc")).isInstanceOf(NonNumericValueException.class);
        assertThatThrownBy(() -> Cells.toDouble("c", true)).isInstanceOf(NonNumericValueException.class);
    }

    @Test
    void cells_toDate_acceptsCommonShapes() {
        LocalDate day = LocalDate.of(2024, 3, 1);
        assertThat(Cells.toDate("2024-03-01")).isEqualTo(day);
        assertThat(Cells.toDate("2024-03-01T10:15:00")).isEqualTo(day);
        assertThat(Cells.toDate(LocalDateTime.of(2024, 3, 1, 23, 59))).isEqualTo(day);
        assertThat(Cells.toDate("2024-03-01 10:15:00")).isEqualTo(day);
        assertThat(Cells.toDate("2024-03-01T23:30:00-05:00")).isEqualTo(day);
        assertThat(Cells.toDate("2024-03-01T00:00:00Z[UTC]")).isEqualTo(day);
        assertThat(Cells.toDate(null)).isNull();
        assertThat(Cells.toDate("  ")).isNull();
    }

    @Test
    void cells_toDate_rejectsNonDates() {
        assertThatThrownBy(() -> Cells.toDate("day", "not a date"))
            .isInstanceOf(InvalidDateException.class)
            .hasMessageContaining("day");
        assertThatThrownBy(() -> Cells.toDate("01/03/2024")).isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> Cells.toDate(20240301)).isInstanceOf(InvalidDateException.class);
    }
}
