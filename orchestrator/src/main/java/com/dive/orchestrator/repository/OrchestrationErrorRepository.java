package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.OrchestrationError;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OrchestrationErrorRepository extends JpaRepository<OrchestrationError, Long> {

    List<OrchestrationError> findByInstanceCodeOrderByRecordedAtDescIdDesc(String instanceCode, Pageable page);

    /** Severity is 1 = critical, so "at least as severe" means a numerically lower value. */
    long countByInstanceCodeAndSeverityLessThanEqual(String instanceCode, int severity);
}
