package com.anomalywatch.service;

import com.anomalywatch.comparison.ComparisonEngine;
import com.anomalywatch.comparison.ComparisonSettings;
import com.anomalywatch.dto.AnomalyRecordResponse;
import com.anomalywatch.dto.DetectionRequest;
import com.anomalywatch.dto.DetectionResponse;
import com.anomalywatch.dto.PivotSpec;
import com.anomalywatch.dto.TransformerSpec;
import com.anomalywatch.entity.AnomalyRecord;
import com.anomalywatch.exception.InvalidQuantileIndexException;
import com.anomalywatch.repository.AnomalyRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    private static final String INTERVAL = "100|90|92|95|98|100|102|105|108|110";

    @Mock AnomalyRecordRepository repository;
    @Captor ArgumentCaptor<List<AnomalyRecord>> saved;

    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyDetectionService(
            new ComparisonEngine(ComparisonSettings.defaults()), new TransformerFactory(), repository);
    }

    private DetectionRequest.DetectionRequestBuilder request() {
        return DetectionRequest.builder()
            .forecastRows(List.of(Map.of("date", "2024-01-01", "desktop_organic", INTERVAL, "mobile_paid", INTERVAL)))
            .actualRows(List.of(
                Map.of("date", "2024-01-01", "platform", "desktop", "channel", "organic", "sessions", 115),
                Map.of("date", "2024-01-01", "platform", "mobile", "channel", "paid", "sessions", 80)))
            .pivot(PivotSpec.builder().indexColumns(List.of("date"))
                .dimensionColumns(List.of("platform", "channel")).valueColumn("sessions").build());
    }

    @Test
    void detect_countsStatusesWithoutPersisting() {
        DetectionResponse resp = service.detect(request().build(), "req-1");

        assertThat(resp.getResultCount()).isEqualTo(2);
        assertThat(resp.getAnomalyCount()).isEqualTo(2);
        assertThat(resp.getStatusCounts()).containsEntry("ABOVE_UPPER", 1L).containsEntry("BELOW_LOWER", 1L);
        assertThat(resp.isPersisted()).isFalse();
        verifyNoInteractions(repository);
    }

    @Test
    void detect_requestOverridesDecomposeAndFilter() {
        DetectionResponse resp = service.detect(request()
            .dimensionNames(List.of("platform", "channel"))
            .transformers(Map.of("after_detection", List.of(TransformerSpec.builder()
                .kind(TransformerSpec.Kind.VALUE_FILTER).column("platform").values(List.of("mobile")).build())))
            .build(), "req-2");

        assertThat(resp.getResultCount()).isEqualTo(1);
        assertThat(resp.getRows().get(0)).containsEntry("channel", "paid").containsEntry("status", "BELOW_LOWER");
    }

    @Test
    void detect_persistWritesRecords() {
        service.detect(request().persist(true).build(), "req-3");
        verify(repository).saveAll(saved.capture());
        assertThat(saved.getValue()).hasSize(2)
            .allSatisfy(r -> assertThat(r.getRequestId()).isEqualTo("req-3"));
    }

    @Test
    void detect_invalidIndexOverride_isRejected() {
        assertThatThrownBy(() -> service.detect(request().lowerIndex(9).upperIndex(1).build(), "req-4"))
            .isInstanceOf(InvalidQuantileIndexException.class);
    }

    @Test
    void getHistory_mapsRecords() {
        AnomalyRecord record = AnomalyRecord.builder().id(UUID.randomUUID())
            .observedDate(LocalDate.of(2024, 1, 1)).metricKey("a").status("ABOVE_UPPER")
            .deviationPct(4.5).requestId("req-5").build();
        when(repository.findHistory(eq("a"), isNull(), isNull(), isNull(), any()))
            .thenReturn(new PageImpl<>(List.of(record)));

        Page<AnomalyRecordResponse> page = service.getHistory("a", null, null, null, PageRequest.of(0, 20));

        assertThat(page.getContent()).singleElement()
            .satisfies(r -> {
                assertThat(r.getMetricKey()).isEqualTo("a");
                assertThat(r.getDeviationPct()).isEqualTo(4.5);
            });
    }
}
