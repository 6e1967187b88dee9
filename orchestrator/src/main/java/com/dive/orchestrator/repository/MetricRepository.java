package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.OrchestrationMetric;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MetricRepository extends JpaRepository<OrchestrationMetric, Long> {

    /** Latest sample values of one metric across every instance, newest first. */
    @Query("""
            SELECT m.value FROM OrchestrationMetric m
            WHERE m.metricName = :metricName
            ORDER BY m.recordedAt DESC
            """)
    List<Double> findRecentValues(@Param("metricName") String metricName, Pageable page);
}
