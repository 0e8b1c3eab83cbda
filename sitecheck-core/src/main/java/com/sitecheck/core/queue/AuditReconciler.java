package com.sitecheck.core.queue;

import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.core.queue.model.AuditEvidence;
import com.sitecheck.data.entity.Audit;
import com.sitecheck.data.entity.AuditQueueItem;
import com.sitecheck.data.repository.AuditQueueRepository;
import com.sitecheck.data.repository.AuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives the state of an audit from stored evidence and brings status fields in line.
 * Every path that decides "is this audit done?" goes through here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditReconciler {

    private final AuditRepository auditRepository;
    private final AuditQueueRepository queueRepository;

    /**
     * Fresh read of the audit, empty when it no longer exists.
     */
    public Optional<AuditEvidence> readEvidence(UUID auditId) {
        return auditRepository.findById(auditId).map(this::toEvidence);
    }

    /**
     * If the audit shows any success evidence, mark it and the given queue entry completed.
     * Safe to call any number of times.
     *
     * @param jobId queue entry to complete alongside the audit, may be {@code null}
     * @return the evidence the decision was based on, empty when the audit is gone
     */
    public Optional<AuditEvidence> reconcile(UUID auditId, UUID jobId) {
        Optional<AuditEvidence> evidence = readEvidence(auditId);
        evidence.filter(AuditEvidence::isComplete).ifPresent(e -> {
            Instant now = Instant.now();
            if (auditRepository.markCompleted(auditId, now) > 0) {
                log.info("[RECONCILE] Audit marked completed from evidence | auditId={} | report={} | email={}",
                    auditId, e.isReportPresent(), e.getEmailMarker());
            }
            if (jobId != null && queueRepository.markCompleted(jobId, now) > 0) {
                log.info("[RECONCILE] Queue entry marked completed | jobId={} | auditId={}", jobId, auditId);
            }
        });
        return evidence;
    }

    /**
     * Reconcile an audit together with every queue entry that belongs to it.
     */
    public Optional<AuditEvidence> reconcileAll(UUID auditId) {
        Optional<AuditEvidence> evidence = reconcile(auditId, null);
        if (evidence.map(AuditEvidence::isComplete).orElse(false)) {
            Instant now = Instant.now();
            for (AuditQueueItem item : queueRepository.findByAuditIdOrderByCreatedAtDesc(auditId)) {
                if (item.getStatus() != QueueStatus.COMPLETED) {
                    queueRepository.markCompleted(item.getId(), now);
                }
            }
        }
        return evidence;
    }

    private AuditEvidence toEvidence(Audit audit) {
        return AuditEvidence.builder()
            .auditId(audit.getId())
            .status(audit.getStatus())
            .reportPresent(audit.hasReport())
            .emailMarker(audit.getParsedEmailMarker())
            .build();
    }
}
