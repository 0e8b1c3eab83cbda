package com.sitecheck.core.queue;

import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.core.queue.model.AuditEvidence;
import com.sitecheck.core.queue.model.ReclaimedItem;
import com.sitecheck.data.entity.AuditQueueItem;
import com.sitecheck.data.repository.AuditQueueRepository;
import com.sitecheck.data.repository.AuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recovers queue entries left in {@code processing} by invocations that died or ran out
 * of time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StuckItemReclaimer {

    private final AuditQueueRepository queueRepository;
    private final AuditRepository auditRepository;
    private final AuditReconciler auditReconciler;
    private final AuditErrorLog auditErrorLog;
    private final QueueProperties properties;

    public List<ReclaimedItem> reclaim() {
        Instant now = Instant.now();
        Instant threshold = now.minus(properties.getStaleThreshold());
        List<AuditQueueItem> stuck = queueRepository.findByStatusAndStartedAtBefore(QueueStatus.PROCESSING, threshold);
        if (stuck.isEmpty()) {
            return List.of();
        }

        log.warn("[RECLAIM] Found {} stuck queue entries | threshold={}", stuck.size(), threshold);
        List<ReclaimedItem> reclaimed = new ArrayList<>();
        for (AuditQueueItem item : stuck) {
            try {
                reclaimOne(item, now, threshold).ifPresent(reclaimed::add);
            } catch (Exception e) {
                log.error("[RECLAIM] Failed to reclaim queue entry {}", item.getId(), e);
            }
        }
        return reclaimed;
    }

    private Optional<ReclaimedItem> reclaimOne(AuditQueueItem item, Instant now, Instant threshold) {
        Optional<AuditEvidence> evidence = auditReconciler.readEvidence(item.getAuditId());

        if (evidence.isPresent() && evidence.get().isComplete()) {
            auditReconciler.reconcile(item.getAuditId(), item.getId());
            log.info("[RECLAIM] Stuck entry had finished its work, marked completed | jobId={} | auditId={}",
                item.getId(), item.getAuditId());
            return Optional.of(toReclaimed(item, QueueStatus.COMPLETED));
        }

        long minutes = item.getStartedAt() != null ? Duration.between(item.getStartedAt(), now).toMinutes() : 0;
        String error = evidence.isPresent()
            ? "Processing timed out after " + minutes + " minutes"
            : "Audit not found";
        QueueStatus newStatus = evidence.isPresent() && item.getRetryCount() < properties.getMaxRetries()
            ? QueueStatus.PENDING
            : QueueStatus.FAILED;

        int updated = queueRepository.resetStuck(item.getId(), newStatus.getValue(), error, threshold, now);
        if (updated == 0) {
            log.debug("[RECLAIM] Entry changed since it was read, skipping | jobId={}", item.getId());
            return Optional.empty();
        }

        if (evidence.isPresent()) {
            String errorLog = auditErrorLog.build(error, true,
                "Queue entry was stuck in processing and was reset to " + newStatus.getValue());
            auditRepository.markFailed(item.getAuditId(), errorLog);
        }

        log.warn("[RECLAIM] Reset stuck entry | jobId={} | auditId={} | newStatus={} | attempts={}/{} | minutesProcessing={}",
            item.getId(), item.getAuditId(), newStatus.getValue(), item.getRetryCount(), properties.getMaxRetries(), minutes);
        return Optional.of(toReclaimed(item, newStatus));
    }

    private ReclaimedItem toReclaimed(AuditQueueItem item, QueueStatus newStatus) {
        return ReclaimedItem.builder()
            .jobId(item.getId())
            .auditId(item.getAuditId())
            .newStatus(newStatus)
            .retryCount(item.getRetryCount())
            .build();
    }
}
