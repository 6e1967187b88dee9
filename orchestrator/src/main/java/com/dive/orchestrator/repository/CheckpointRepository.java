package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.Checkpoint;
import com.dive.orchestrator.model.Phase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint rows, unique per (instance, phase).
 */
public interface CheckpointRepository extends JpaRepository<Checkpoint, Long> {

    Optional<Checkpoint> findByInstanceCodeAndPhase(String instanceCode, Phase phase);

    boolean existsByInstanceCodeAndPhase(String instanceCode, Phase phase);

    List<Checkpoint> findByInstanceCode(String instanceCode);

    Optional<Checkpoint> findFirstByInstanceCodeOrderByCreatedAtDescIdDesc(String instanceCode);

    long deleteByInstanceCodeAndPhase(String instanceCode, Phase phase);

    long deleteByInstanceCode(String instanceCode);
}
