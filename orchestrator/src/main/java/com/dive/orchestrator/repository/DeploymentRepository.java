package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.Deployment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Live state rows, one per instance.
 */
public interface DeploymentRepository extends JpaRepository<Deployment, String> {

    /**
     * Read the row with SELECT ... FOR UPDATE so the previous state and the
     * new state are decided under the same lock. Must run inside the
     * caller's @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Deployment d WHERE d.instanceCode = :instanceCode")
    Optional<Deployment> lockByInstanceCode(@Param("instanceCode") String instanceCode);

    List<Deployment> findAllByOrderByInstanceCodeAsc();
}
