package com.sitecheck.core.queue;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.core.queue.model.AuditEvidence;
import com.sitecheck.core.queue.model.QueueSnapshot;
import com.sitecheck.core.queue.model.RetryResult;
import com.sitecheck.data.entity.Audit;
import com.sitecheck.data.repository.AuditQueueRepository;
import com.sitecheck.data.repository.AuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Queue operations outside the tick: enqueueing, operator retries and status reporting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditQueueService {

    private static final int SNAPSHOT_LIMIT = 20;

    private final AuditQueueRepository queueRepository;
    private final AuditRepository auditRepository;
    private final AuditReconciler auditReconciler;
    private final QueueProperties properties;

    /**
     * Add a pending entry for the audit unless it already has one in any status.
     *
     * @return {@code true} if an entry was created
     */
    public boolean enqueue(UUID auditId) {
        boolean created = queueRepository.insertIfAbsent(UUID.randomUUID(), auditId, Instant.now()) == 1;
        if (created) {
            log.info("[QUEUE] Audit enqueued | auditId={}", auditId);
        }
        return created;
    }

    /**
     * Put an audit back in the queue. Audits whose email already went out are refused,
     * anything else is re-opened and its entries reset with a fresh retry budget.
     */
    public RetryResult retry(UUID auditId) {
        Optional<Audit> audit = auditRepository.findById(auditId);
        if (audit.isEmpty()) {
            return RetryResult.NOT_FOUND;
        }
        if (audit.get().getParsedEmailMarker().isSent()) {
            log.info("[QUEUE] Retry refused, email already sent | auditId={}", auditId);
            return RetryResult.EMAIL_ALREADY_SENT;
        }

        auditRepository.reopen(auditId);
        int reset = queueRepository.resetForRetry(auditId);
        RetryResult result;
        if (reset > 0) {
            result = RetryResult.REQUEUED;
        } else if (enqueue(auditId)) {
            result = RetryResult.CREATED;
        } else {
            result = RetryResult.IN_PROGRESS;
        }
        log.info("[QUEUE] Audit retry requested | auditId={} | result={} | entriesReset={}", auditId, result, reset);
        return result;
    }

    /**
     * Reconcile one audit and all of its entries from stored evidence.
     */
    public Optional<AuditEvidence> complete(UUID auditId) {
        return auditReconciler.reconcileAll(auditId);
    }

    public QueueSnapshot snapshot() {
        Instant now = Instant.now();
        Map<String, Long> queueCounts = new LinkedHashMap<>();
        for (QueueStatus status : QueueStatus.values()) {
            queueCounts.put(status.getValue(), queueRepository.countByStatus(status));
        }
        Map<String, Long> auditCounts = new LinkedHashMap<>();
        for (AuditStatus status : AuditStatus.values()) {
            auditCounts.put(status.getValue(), auditRepository.countByStatus(status));
        }

        Instant threshold = now.minus(properties.getStaleThreshold());
        return QueueSnapshot.builder()
            .queueCounts(queueCounts)
            .auditCounts(auditCounts)
            .stuckItems(queueRepository.findByStatusAndStartedAtBefore(QueueStatus.PROCESSING, threshold).stream()
                .map(item -> QueueSnapshot.StuckEntry.builder()
                    .jobId(item.getId())
                    .auditId(item.getAuditId())
                    .startedAt(item.getStartedAt())
                    .retryCount(item.getRetryCount())
                    .minutesProcessing(Duration.between(item.getStartedAt(), now).toMinutes())
                    .build())
                .collect(Collectors.toList()))
            .auditsWithoutReport(auditRepository.findWithoutReport(PageRequest.of(0, SNAPSHOT_LIMIT)).stream()
                .map(Audit::getId)
                .collect(Collectors.toList()))
            .generatedAt(now)
            .build();
    }
}
