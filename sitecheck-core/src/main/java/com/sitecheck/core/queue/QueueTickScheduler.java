package com.sitecheck.core.queue;

import com.sitecheck.core.queue.model.TickResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for deployments without an external scheduler.
 */
@Component
@ConditionalOnProperty(prefix = "sitecheck.queue.scheduler", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class QueueTickScheduler {

    private final AuditQueueCoordinator coordinator;

    @Scheduled(fixedDelayString = "${sitecheck.queue.scheduler.fixed-delay-ms:60000}",
               initialDelayString = "${sitecheck.queue.scheduler.fixed-delay-ms:60000}")
    public void tick() {
        try {
            TickResult result = coordinator.processNext();
            if (result.isProcessed()) {
                log.info("[SCHEDULER] Tick finished | outcome={} | auditId={}", result.getOutcome(), result.getAuditId());
            }
        } catch (Exception e) {
            log.error("[SCHEDULER] Tick failed", e);
        }
    }
}
