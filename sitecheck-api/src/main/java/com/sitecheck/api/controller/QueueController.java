package com.sitecheck.api.controller;

import com.sitecheck.api.dto.response.ProcessQueueResponse;
import com.sitecheck.core.queue.AuditQueueCoordinator;
import com.sitecheck.core.queue.model.TickResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for the external scheduler. Each call runs one tick.
 */
@RestController
@RequestMapping("/api/process-queue")
@RequiredArgsConstructor
@Slf4j
public class QueueController {

    private final AuditQueueCoordinator coordinator;

    @RequestMapping(method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<ProcessQueueResponse> processQueue() {
        long startTime = System.currentTimeMillis();
        TickResult result = coordinator.processNext();

        log.info("[TICK] Finished | outcome={} | auditId={} | stuckReset={} | durationMs={}",
            result.getOutcome(), result.getAuditId(), result.getStuckItemsReset().size(),
            System.currentTimeMillis() - startTime);
        return ResponseEntity.ok(ProcessQueueResponse.from(result));
    }
}
