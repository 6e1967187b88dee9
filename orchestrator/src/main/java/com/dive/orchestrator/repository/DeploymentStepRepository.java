package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.DeploymentStep;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DeploymentStepRepository extends JpaRepository<DeploymentStep, Long> {

    /** All attempts for an instance, oldest first. */
    List<DeploymentStep> findByInstanceCodeOrderByStartedAtAscIdAsc(String instanceCode);
}
