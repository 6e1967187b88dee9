package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.StateTransition;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only transition log. No update or delete queries live here.
 */
public interface StateTransitionRepository extends JpaRepository<StateTransition, Long> {

    /** Most recent transition; ties on timestamp are broken by insertion order. */
    Optional<StateTransition> findFirstByInstanceCodeOrderByOccurredAtDescIdDesc(String instanceCode);

    Optional<StateTransition> findFirstByInstanceCodeOrderByOccurredAtAscIdAsc(String instanceCode);

    List<StateTransition> findByInstanceCodeOrderByOccurredAtDescIdDesc(String instanceCode, Pageable page);

    long countByInstanceCode(String instanceCode);
}
