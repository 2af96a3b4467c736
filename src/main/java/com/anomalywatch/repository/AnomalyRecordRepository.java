package com.anomalywatch.repository;

import com.anomalywatch.entity.AnomalyRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.UUID;

public interface AnomalyRecordRepository extends JpaRepository<AnomalyRecord, UUID> {

    @Query("""
        SELECT a FROM AnomalyRecord a
        WHERE (:metricKey IS NULL OR a.metricKey = :metricKey)
          AND (:status IS NULL OR a.status = :status)
          AND (:fromDate IS NULL OR a.observedDate >= :fromDate)
          AND (:toDate IS NULL OR a.observedDate <= :toDate)
    """)
    Page<AnomalyRecord> findHistory(
        @Param("metricKey") String metricKey,
        @Param("status") String status,
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate,
        Pageable pageable);
}
