package com.anomalywatch.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "anomaly_records",
    indexes = {
        @Index(name = "idx_anomaly_date",    columnList = "observed_date"),
        @Index(name = "idx_anomaly_metric",  columnList = "metric_key"),
        @Index(name = "idx_anomaly_status",  columnList = "status"),
        @Index(name = "idx_anomaly_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnomalyRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "observed_date")
    private LocalDate observedDate;

    @Column(name = "metric_key", nullable = false, length = 255)
    private String metricKey;

    @Column(name = "metric_name", length = 100)
    private String metricName;

    @Column(name = "actual_value")
    private Double actualValue;

    @Column(name = "forecast_value")
    private Double forecastValue;

    @Column(name = "lower_bound")
    private Double lowerBound;

    @Column(name = "upper_bound")
    private Double upperBound;

    @Column(nullable = false, length = 20)
    private String status;

    @Column(name = "deviation_pct")
    private Double deviationPct;

    @Column(name = "deviation_undefined")
    private boolean deviationUndefined;

    /** Decomposed dimensions as {@code name=value} pairs joined with {@code ;}. */
    @Column(length = 1000)
    private String dimensions;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
