package com.dive.orchestrator.repository;

import com.dive.orchestrator.model.DeploymentLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Lock primitives as single native statements.
 *
 * Each method is one atomic statement, so two orchestrator processes racing
 * for the same instance are serialized by Postgres' row lock on the unique
 * key. All return the number of affected rows (0 = not acquired / not held).
 */
public interface DeploymentLockRepository extends JpaRepository<DeploymentLock, String> {

    /**
     * Insert the lock row, or take it over when it is held by the same holder
     * (re-entrant: hold_count + 1) or has expired (stale: hold_count reset).
     * A live lock owned by someone else is left untouched and 0 is returned.
     */
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO deployment_locks (instance_code, holder, hold_count, acquired_at, expires_at)
            VALUES (:instanceCode, :holder, 1, :now, :expiresAt)
            ON CONFLICT (instance_code) DO UPDATE
               SET hold_count  = CASE WHEN deployment_locks.holder = EXCLUDED.holder
                                       AND deployment_locks.expires_at > :now
                                      THEN deployment_locks.hold_count + 1 ELSE 1 END,
                   acquired_at = CASE WHEN deployment_locks.holder = EXCLUDED.holder
                                       AND deployment_locks.expires_at > :now
                                      THEN deployment_locks.acquired_at ELSE EXCLUDED.acquired_at END,
                   holder      = EXCLUDED.holder,
                   expires_at  = EXCLUDED.expires_at
             WHERE deployment_locks.holder = EXCLUDED.holder
                OR deployment_locks.expires_at <= :now
            """, nativeQuery = true)
    int tryAcquire(@Param("instanceCode") String instanceCode,
                   @Param("holder") String holder,
                   @Param("now") Instant now,
                   @Param("expiresAt") Instant expiresAt);

    /** Drop one re-entrant hold; affects a row only while more than one hold remains. */
    @Transactional
    @Modifying
    @Query(value = """
            UPDATE deployment_locks SET hold_count = hold_count - 1
             WHERE instance_code = :instanceCode AND holder = :holder AND hold_count > 1
            """, nativeQuery = true)
    int decrementHold(@Param("instanceCode") String instanceCode, @Param("holder") String holder);

    @Transactional
    @Modifying
    @Query(value = "DELETE FROM deployment_locks WHERE instance_code = :instanceCode AND holder = :holder",
           nativeQuery = true)
    int deleteHeld(@Param("instanceCode") String instanceCode, @Param("holder") String holder);

    @Transactional
    @Modifying
    @Query(value = """
            UPDATE deployment_locks SET expires_at = :expiresAt
             WHERE instance_code = :instanceCode AND holder = :holder AND expires_at > :now
            """, nativeQuery = true)
    int extend(@Param("instanceCode") String instanceCode,
               @Param("holder") String holder,
               @Param("now") Instant now,
               @Param("expiresAt") Instant expiresAt);

    /** Operator "clean locks": remove the row whoever holds it. */
    @Transactional
    @Modifying
    @Query(value = "DELETE FROM deployment_locks WHERE instance_code = :instanceCode", nativeQuery = true)
    int forceDelete(@Param("instanceCode") String instanceCode);
}
