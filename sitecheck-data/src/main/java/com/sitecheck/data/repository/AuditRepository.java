package com.sitecheck.data.repository;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.data.entity.Audit;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AuditRepository extends JpaRepository<Audit, UUID> {

    @Query("SELECT c.email FROM Audit a JOIN a.customer c WHERE a.id = :auditId")
    Optional<String> findCustomerEmail(@Param("auditId") UUID auditId);

    @Query("SELECT a.url FROM Audit a WHERE a.id = :auditId")
    Optional<String> findUrl(@Param("auditId") UUID auditId);

    /**
     * Audits still waiting for an outcome that have no queue entry at all.
     */
    @Query("""
        SELECT a.id FROM Audit a
        WHERE a.status IN :statuses
          AND (a.emailMarker IS NULL OR a.emailMarker LIKE 'sending:%')
          AND NOT EXISTS (SELECT q.id FROM AuditQueueItem q WHERE q.auditId = a.id)
        ORDER BY a.createdAt ASC
        """)
    List<UUID> findOrphanIds(@Param("statuses") Collection<AuditStatus> statuses, Pageable pageable);

    @Query("SELECT a FROM Audit a WHERE a.formattedReportHtml IS NULL ORDER BY a.createdAt DESC")
    List<Audit> findWithoutReport(Pageable pageable);

    long countByStatus(AuditStatus status);

    // email marker transitions; see EmailMarker

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits SET email_marker = :reservation
        WHERE id = :id AND email_marker IS NULL
        """, nativeQuery = true)
    int reserveEmail(@Param("id") UUID id, @Param("reservation") String reservation);

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits SET email_marker = :reservation
        WHERE id = :id AND email_marker = :expected
        """, nativeQuery = true)
    int takeOverEmailReservation(
        @Param("id") UUID id,
        @Param("expected") String expected,
        @Param("reservation") String reservation
    );

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits SET email_marker = :sent
        WHERE id = :id AND email_marker = :reservation
        """, nativeQuery = true)
    int commitEmail(@Param("id") UUID id, @Param("reservation") String reservation, @Param("sent") String sent);

    /**
     * Record a send whose reservation was lost to a takeover. Never replaces a committed value.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits SET email_marker = :sent
        WHERE id = :id AND (email_marker IS NULL OR email_marker LIKE 'sending:%')
        """, nativeQuery = true)
    int forceCommitEmail(@Param("id") UUID id, @Param("sent") String sent);

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits SET email_marker = NULL
        WHERE id = :id AND email_marker = :reservation
        """, nativeQuery = true)
    int releaseEmailReservation(@Param("id") UUID id, @Param("reservation") String reservation);

    // status and report transitions

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits
        SET formatted_report_html = :html,
            formatted_report_plaintext = :plaintext
        WHERE id = :id
        """, nativeQuery = true)
    int storeReport(@Param("id") UUID id, @Param("html") String html, @Param("plaintext") String plaintext);

    /**
     * pending/failed -> running, only while nothing proves the audit already succeeded.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits SET status = 'running'
        WHERE id = :id
          AND status IN ('pending', 'failed')
          AND formatted_report_html IS NULL
        """, nativeQuery = true)
    int markRunning(@Param("id") UUID id);

    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits
        SET status = 'completed',
            completed_at = COALESCE(completed_at, :now)
        WHERE id = :id
          AND status <> 'completed'
        """, nativeQuery = true)
    int markCompleted(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * pending/running -> failed, refused when a report or a committed email exists.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits
        SET status = 'failed',
            error_log = :errorLog
        WHERE id = :id
          AND status IN ('pending', 'running')
          AND formatted_report_html IS NULL
          AND (email_marker IS NULL OR email_marker LIKE 'sending:%')
        """, nativeQuery = true)
    int markFailed(@Param("id") UUID id, @Param("errorLog") String errorLog);

    /**
     * Put an audit whose email never went out back in front of the queue.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE audits
        SET status = 'running',
            error_log = NULL
        WHERE id = :id
          AND (email_marker IS NULL OR email_marker LIKE 'sending:%')
        """, nativeQuery = true)
    int reopen(@Param("id") UUID id);
}
