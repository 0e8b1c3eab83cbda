package com.sitecheck.data.repository;

import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.data.entity.AuditQueueItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue entries. Every state transition is a single conditional UPDATE; callers read the
 * returned row count, where {@code 0} means another invocation got there first.
 */
@Repository
public interface AuditQueueRepository extends JpaRepository<AuditQueueItem, UUID> {

    List<AuditQueueItem> findByStatusOrderByCreatedAtAsc(QueueStatus status, Pageable pageable);

    List<AuditQueueItem> findByStatusAndStartedAtBefore(QueueStatus status, Instant threshold);

    List<AuditQueueItem> findByAuditIdOrderByCreatedAtDesc(UUID auditId);

    List<AuditQueueItem> findAllByOrderByCreatedAtDesc(Pageable pageable);

    boolean existsByAuditId(UUID auditId);

    long countByStatus(QueueStatus status);

    /**
     * Point read of the status column, bypassing any cached entity state.
     */
    @Query(value = "SELECT status FROM audit_queue WHERE id = :id", nativeQuery = true)
    Optional<String> findCurrentStatus(@Param("id") UUID id);

    /**
     * pending -> processing. Exactly one concurrent caller can see {@code 1}.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'processing',
            started_at = :now,
            locked_by = :lockedBy,
            retry_count = retry_count + 1
        WHERE id = :id
          AND status = 'pending'
        """, nativeQuery = true)
    int claim(@Param("id") UUID id, @Param("lockedBy") String lockedBy, @Param("now") Instant now);

    /**
     * Undo a claim that turned out to have nothing to do, refunding the attempt.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'pending',
            started_at = NULL,
            locked_by = NULL,
            retry_count = CASE WHEN retry_count > 0 THEN retry_count - 1 ELSE 0 END
        WHERE id = :id
          AND status = 'processing'
          AND locked_by = :lockedBy
        """, nativeQuery = true)
    int releaseClaim(@Param("id") UUID id, @Param("lockedBy") String lockedBy);

    /**
     * Any non-completed entry -> completed. Evidence of success always wins.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'completed',
            completed_at = :now,
            locked_by = NULL
        WHERE id = :id
          AND status <> 'completed'
        """, nativeQuery = true)
    int markCompleted(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'pending',
            started_at = NULL,
            locked_by = NULL,
            last_error = :lastError
        WHERE id = :id
          AND status = 'processing'
          AND locked_by = :lockedBy
        """, nativeQuery = true)
    int requeueClaimed(@Param("id") UUID id, @Param("lockedBy") String lockedBy, @Param("lastError") String lastError);

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'failed',
            completed_at = :now,
            locked_by = NULL,
            last_error = :lastError
        WHERE id = :id
          AND status = 'processing'
          AND locked_by = :lockedBy
        """, nativeQuery = true)
    int failClaimed(
        @Param("id") UUID id,
        @Param("lockedBy") String lockedBy,
        @Param("lastError") String lastError,
        @Param("now") Instant now
    );

    /**
     * pending -> failed without a claim, for entries that can never be processed.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'failed',
            completed_at = :now,
            last_error = :lastError
        WHERE id = :id
          AND status = 'pending'
        """, nativeQuery = true)
    int failPending(@Param("id") UUID id, @Param("lastError") String lastError, @Param("now") Instant now);

    /**
     * Reset a stuck entry. The staleness condition is re-checked so an entry re-claimed
     * since it was read is left alone.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = :newStatus,
            started_at = NULL,
            locked_by = NULL,
            last_error = :lastError,
            completed_at = CASE WHEN :newStatus = 'failed' THEN :now ELSE completed_at END
        WHERE id = :id
          AND status = 'processing'
          AND started_at < :threshold
        """, nativeQuery = true)
    int resetStuck(
        @Param("id") UUID id,
        @Param("newStatus") String newStatus,
        @Param("lastError") String lastError,
        @Param("threshold") Instant threshold,
        @Param("now") Instant now
    );

    /**
     * Insert a pending entry unless the audit already has one, in any status.
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO audit_queue (id, audit_id, status, created_at, retry_count)
        SELECT :id, :auditId, 'pending', :now, 0
        WHERE NOT EXISTS (SELECT 1 FROM audit_queue WHERE audit_id = :auditId)
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id, @Param("auditId") UUID auditId, @Param("now") Instant now);

    /**
     * Put every non-processing entry of an audit back to a fresh pending state.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audit_queue
        SET status = 'pending',
            retry_count = 0,
            last_error = NULL,
            started_at = NULL,
            completed_at = NULL,
            locked_by = NULL
        WHERE audit_id = :auditId
          AND status <> 'processing'
        """, nativeQuery = true)
    int resetForRetry(@Param("auditId") UUID auditId);
}
