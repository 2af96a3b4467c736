package com.anomalywatch.comparison;

import com.anomalywatch.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricDecomposerTest {

    private final MetricDecomposer decomposer = new MetricDecomposer(List.of("platform", "channel", "page"));

    @Test
    void decompose_mapsSegmentsToNamesInOrder() {
        Map<String, String> dims = decomposer.decompose("desktop_organic_homepage");
        assertThat(dims).containsExactly(
            Map.entry("platform", "desktop"),
            Map.entry("channel", "organic"),
            Map.entry("page", "homepage"));
    }

    @Test
    void decompose_tooFewSegments_throws() {
        assertThatThrownBy(() -> decomposer.decompose("desktop_organic"))
            .isInstanceOf(DimensionMismatchException.class)
            .hasMessageContaining("2 segment(s)");
    }

    @Test
    void decompose_separatorInsideValue_isAMismatch() {
        assertThatThrownBy(() -> decomposer.decompose("desktop_paid_search_homepage"))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void decompose_emptySegmentsAreKept() {
        assertThat(decomposer.decompose("desktop__homepage")).containsEntry("channel", "");
    }

    @Test
    void customSeparator_isTakenLiterally() {
        MetricDecomposer dotted = new MetricDecomposer(List.of("a", "b"), ".");
        assertThat(dotted.decompose("x.y")).containsEntry("a", "x").containsEntry("b", "y");
    }

    @Test
    void compose_isInverseOfDecompose() {
        String key = MetricDecomposer.compose(List.of("mobile", "paid", "checkout"), "_");
        assertThat(key).isEqualTo("mobile_paid_checkout");
        assertThat(decomposer.decompose(key).values()).containsExactly("mobile", "paid", "checkout");
    }
}
