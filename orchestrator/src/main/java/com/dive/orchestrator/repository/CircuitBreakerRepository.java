package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.CircuitBreakerRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable circuit breaker rows.
 */
public interface CircuitBreakerRepository extends JpaRepository<CircuitBreakerRecord, String> {

    /**
     * SELECT ... FOR UPDATE on the breaker row. Every state transition reads
     * through this so concurrent pipelines for different instances observe
     * and mutate a breaker one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CircuitBreakerRecord c WHERE c.operationName = :operationName")
    Optional<CircuitBreakerRecord> lockByOperationName(@Param("operationName") String operationName);

    /** Create the row in CLOSED state unless another process already did. */
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO circuit_breakers (operation_name, state, failure_count, success_count, open_count, updated_at)
            VALUES (:operationName, 'CLOSED', 0, 0, 0, :now)
            ON CONFLICT (operation_name) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("operationName") String operationName, @Param("now") Instant now);

    List<CircuitBreakerRecord> findAllByOrderByOperationNameAsc();
}
