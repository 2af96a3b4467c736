package com.anomalywatch.comparison;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.DimensionMismatchException;
import com.anomalywatch.exception.DuplicateTimePointException;
import com.anomalywatch.exception.InvalidDateException;
import com.anomalywatch.exception.InvalidQuantileIndexException;
import com.anomalywatch.exception.MalformedQuantileException;
import com.anomalywatch.exception.MissingColumnException;
import com.anomalywatch.quantile.QuantileIndices;
import com.anomalywatch.quantile.QuantileVector;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ComparisonEngineTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 1);
    private static final String INTERVAL = "100|90|92|95|98|100|102|105|108|110";
    private static final String ZEROS = "0|0|0|0|0|0|0|0|0|0";

    private final ComparisonEngine engine = new ComparisonEngine(ComparisonSettings.defaults());

    private static DataBatch forecast(String metric, Object cell) {
        return DataBatch.builder(List.of("date", metric)).row(DAY, cell).build();
    }

    private static DataBatch actual(String metric, Object value) {
        return DataBatch.builder(List.of("date", metric)).row(DAY, value).build();
    }

    @Test
    void aboveUpper_reportsDeviationFromUpperBound() {
        List<ComparisonResult> results = engine.compare(forecast("sessions", INTERVAL), actual("sessions", 115));

        assertThat(results).hasSize(1);
        ComparisonResult r = results.get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.ABOVE_UPPER);
        assertThat(r.getDeviationPct()).isCloseTo(4.545, within(0.001));
        assertThat(r.getLowerBound()).isEqualTo(90.0);
        assertThat(r.getUpperBound()).isEqualTo(110.0);
        assertThat(r.getForecast()).isEqualTo(100.0);
        assertThat(r.getActual()).isEqualTo(115.0);
        assertThat(r.getDate()).isEqualTo(DAY);
    }

    @Test
    void valueOnLowerBound_isInRange() {
        ComparisonResult r = engine.compare(forecast("sessions", INTERVAL), actual("sessions", 90)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.IN_RANGE);
        assertThat(r.getDeviationPct()).isZero();
    }

    @Test
    void belowLower_reportsPositiveDeviationFromLowerBound() {
        ComparisonResult r = engine.compare(forecast("sessions", INTERVAL), actual("sessions", 81)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.BELOW_LOWER);
        assertThat(r.getDeviationPct()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void allZeroVector_isNoForecast() {
        ComparisonResult r = engine.compare(forecast("sessions", ZEROS), actual("sessions", 50)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.NO_FORECAST);
        assertThat(r.getDeviationPct()).isZero();
    }

    @Test
    void zeroBoundWithoutSentinel_flagsDeviationUndefined() {
        // lower -5, upper 0: not the sentinel
        String cell = "0|-5|0|0|0|0|0|0|0|0";
        ComparisonResult r = engine.compare(forecast("m", cell), actual("m", 3)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.ABOVE_UPPER);
        assertThat(r.getDeviationPct()).isZero();
        assertThat(r.isDeviationUndefined()).isTrue();
    }

    @Test
    void actualOnlyMetric_isNoForecast_andForecastOnlyMetricIsSkipped() {
        DataBatch fc = DataBatch.builder(List.of("date", "a", "b")).row(DAY, INTERVAL, INTERVAL).build();
        DataBatch ac = DataBatch.builder(List.of("date", "a", "c")).row(DAY, 100, 7).build();

        List<ComparisonResult> results = engine.compare(fc, ac);

        assertThat(results).extracting(ComparisonResult::getMetricKey).containsExactly("a", "c");
        assertThat(results.get(1).getStatus()).isEqualTo(AnomalyStatus.NO_FORECAST);
        assertThat(results.get(1).getLowerBound()).isNull();
    }

    @Test
    void dateWithoutForecastRow_isNoForecast() {
        DataBatch fc = forecast("a", INTERVAL);
        DataBatch ac = DataBatch.builder(List.of("date", "a")).row(DAY.plusDays(1), 100).build();
        assertThat(engine.compare(fc, ac).get(0).getStatus()).isEqualTo(AnomalyStatus.NO_FORECAST);
    }

    @Test
    void missingActualCell_isSkipped() {
        DataBatch ac = DataBatch.builder(List.of("date", "a", "b")).row(DAY, Double.NaN, null).build();
        DataBatch fc = DataBatch.builder(List.of("date", "a", "b")).row(DAY, INTERVAL, INTERVAL).build();
        assertThat(engine.compare(fc, ac)).isEmpty();
    }

    @Test
    void blankForecastCell_isNoForecast() {
        ComparisonResult r = engine.compare(forecast("a", ""), actual("a", 10)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.NO_FORECAST);
    }

    @Test
    void acceptsParsedVectors() {
        ComparisonResult r = engine.compare(forecast("a", QuantileVector.parse(INTERVAL)), actual("a", 100)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.IN_RANGE);
    }

    @Test
    void datesMatchAcrossStringAndLocalDateCells() {
        DataBatch fc = DataBatch.builder(List.of("date", "a")).row("2024-01-01", INTERVAL).build();
        ComparisonResult r = engine.compare(fc, actual("a", 120)).get(0);
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.ABOVE_UPPER);
    }

    @Test
    void sqlAndOffsetTimestamps_matchTheirCalendarDate() {
        DataBatch ac = DataBatch.builder(List.of("date", "a")).row("2024-01-01 00:00:00", 200).build();
        assertThat(engine.compare(forecast("a", INTERVAL), ac).get(0))
            .returns(DAY, ComparisonResult::getDate)
            .returns(AnomalyStatus.ABOVE_UPPER, ComparisonResult::getStatus);

        DataBatch fc = DataBatch.builder(List.of("date", "a")).row("2024-01-01T00:00:00Z", INTERVAL).build();
        assertThat(engine.compare(fc, actual("a", 200)).get(0).getStatus()).isEqualTo(AnomalyStatus.ABOVE_UPPER);
    }

    @Test
    void unparsableActualDate_throws() {
        DataBatch ac = DataBatch.builder(List.of("date", "a")).row("01/01/2024", 200).build();
        assertThatThrownBy(() -> engine.compare(forecast("a", INTERVAL), ac))
            .isInstanceOf(InvalidDateException.class)
            .hasMessageContaining("01/01/2024");
    }

    @Test
    void unparsableForecastDate_throws() {
        DataBatch fc = DataBatch.builder(List.of("date", "a")).row("01/01/2024", INTERVAL).build();
        assertThatThrownBy(() -> engine.compare(fc, actual("a", 200)))
            .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void rowWithoutDate_throws() {
        DataBatch ac = DataBatch.builder(List.of("date", "a")).row(null, 200).build();
        assertThatThrownBy(() -> engine.compare(forecast("a", INTERVAL), ac))
            .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void malformedForecastCell_throws() {
        assertThatThrownBy(() -> engine.compare(forecast("a", "1|2|3"), actual("a", 1)))
            .isInstanceOf(MalformedQuantileException.class);
    }

    @Test
    void duplicateForecastDate_throws() {
        DataBatch fc = DataBatch.builder(List.of("date", "a")).row(DAY, INTERVAL).row(DAY, INTERVAL).build();
        assertThatThrownBy(() -> engine.compare(fc, actual("a", 1)))
            .isInstanceOf(DuplicateTimePointException.class);
    }

    @Test
    void missingDateColumn_throws() {
        DataBatch ac = DataBatch.builder(List.of("day", "a")).row(DAY, 1).build();
        assertThatThrownBy(() -> engine.compare(forecast("a", INTERVAL), ac))
            .isInstanceOf(MissingColumnException.class);
    }

    @Test
    void customIndices_changeTheInterval() {
        ComparisonEngine narrow = new ComparisonEngine(ComparisonSettings.builder()
            .indices(new QuantileIndices(4, 6, 5)).build());
        // p40..p60 = 98..102
        assertThat(narrow.compare(forecast("a", INTERVAL), actual("a", 105)).get(0).getStatus())
            .isEqualTo(AnomalyStatus.ABOVE_UPPER);
    }

    @Test
    void invalidIndices_failAtConstruction() {
        assertThatThrownBy(() -> new ComparisonEngine(ComparisonSettings.builder()
            .indices(new QuantileIndices(1, 10, 5)).build()))
            .isInstanceOf(InvalidQuantileIndexException.class);
    }

    @Test
    void dimensions_areDecomposedIntoResultColumns() {
        ComparisonEngine withDims = new ComparisonEngine(ComparisonSettings.builder()
            .dimensionNames(List.of("platform", "channel", "page"))
            .metricName("sessions")
            .build());

        DataBatch result = withDims.detect(
            forecast("desktop_organic_homepage", INTERVAL),
            actual("desktop_organic_homepage", 115));

        assertThat(result.getColumns()).containsExactly(
            "date", "metric", "metric_name", "actual", "forecast", "lower_bound", "upper_bound",
            "status", "deviation_pct", "deviation_undefined", "platform", "channel", "page");
        Map<String, Object> row = result.getRow(0);
        assertThat(row).containsEntry("platform", "desktop")
            .containsEntry("channel", "organic")
            .containsEntry("page", "homepage")
            .containsEntry("metric_name", "sessions")
            .containsEntry("status", "ABOVE_UPPER");
    }

    @Test
    void dimensionMismatch_throwsBeforeAnyResult() {
        ComparisonEngine withDims = new ComparisonEngine(ComparisonSettings.builder()
            .dimensionNames(List.of("platform", "channel", "page"))
            .build());
        assertThatThrownBy(() -> withDims.compare(forecast("desktop_organic", INTERVAL), actual("desktop_organic", 1)))
            .isInstanceOf(DimensionMismatchException.class)
            .hasMessageContaining("desktop_organic");
    }

    @Test
    void emptyActual_yieldsEmptyResultWithSchema() {
        DataBatch result = engine.detect(forecast("a", INTERVAL), DataBatch.empty(List.of("date", "a")));
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getColumns()).contains("status", "deviation_pct");
    }

    @Test
    void classify_exactlyOneStatusWithInclusiveBounds() {
        assertThat(ComparisonEngine.classify(10, 10, 20).status()).isEqualTo(AnomalyStatus.IN_RANGE);
        assertThat(ComparisonEngine.classify(20, 10, 20).status()).isEqualTo(AnomalyStatus.IN_RANGE);
        assertThat(ComparisonEngine.classify(9.999, 10, 20).status()).isEqualTo(AnomalyStatus.BELOW_LOWER);
        assertThat(ComparisonEngine.classify(20.001, 10, 20).status()).isEqualTo(AnomalyStatus.ABOVE_UPPER);
    }

    @Test
    void classify_deviationIsNeverNegative() {
        assertThat(ComparisonEngine.classify(-30, -10, -5).deviationPct()).isCloseTo(200.0, within(1e-9));
        assertThat(ComparisonEngine.classify(0, -10, -5).deviationPct()).isCloseTo(100.0, within(1e-9));
    }
}
