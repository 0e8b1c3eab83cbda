package com.sitecheck.core.queue;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.data.repository.AuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Gives a queue entry to every open audit that never got one, e.g. when checkout
 * created the audit but failed before enqueueing it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrphanAuditReconciler {

    private static final List<AuditStatus> OPEN_STATUSES = Arrays.stream(AuditStatus.values())
        .filter(AuditStatus::isOpen)
        .collect(Collectors.toList());

    private final AuditRepository auditRepository;
    private final AuditQueueService queueService;
    private final QueueProperties properties;

    /**
     * @return number of entries created
     */
    public int reconcileOrphans() {
        List<UUID> orphanIds = auditRepository.findOrphanIds(OPEN_STATUSES, PageRequest.of(0, properties.getBatchSize()));
        if (orphanIds.isEmpty()) {
            return 0;
        }

        int queued = 0;
        for (UUID auditId : orphanIds) {
            if (queueService.enqueue(auditId)) {
                queued++;
            }
        }
        log.info("[ORPHANS] Queued orphaned audits | found={} | queued={}", orphanIds.size(), queued);
        return queued;
    }
}
