package com.sitecheck.api.controller;

import com.sitecheck.api.dto.response.AdminActionResponse;
import com.sitecheck.api.dto.response.ProcessQueueResponse;
import com.sitecheck.core.queue.AuditQueueService;
import com.sitecheck.core.queue.OrphanAuditReconciler;
import com.sitecheck.core.queue.StuckItemReclaimer;
import com.sitecheck.core.queue.model.AuditEvidence;
import com.sitecheck.core.queue.model.QueueSnapshot;
import com.sitecheck.core.queue.model.ReclaimedItem;
import com.sitecheck.core.queue.model.RetryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator tools for inspecting and repairing the audit queue.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final AuditQueueService queueService;
    private final StuckItemReclaimer stuckItemReclaimer;
    private final OrphanAuditReconciler orphanAuditReconciler;

    @GetMapping("/queue-status")
    public ResponseEntity<QueueSnapshot> queueStatus() {
        return ResponseEntity.ok(queueService.snapshot());
    }

    @PostMapping("/audits/{auditId}/retry")
    public ResponseEntity<AdminActionResponse> retryAudit(@PathVariable UUID auditId) {
        log.info("[ADMIN] Retry requested | auditId={}", auditId);
        RetryResult result = queueService.retry(auditId);

        AdminActionResponse.AdminActionResponseBuilder response = AdminActionResponse.builder()
            .action("retry")
            .auditId(auditId)
            .result(result.name().toLowerCase());

        switch (result) {
            case NOT_FOUND:
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(response.success(false).message("Audit not found").build());
            case EMAIL_ALREADY_SENT:
                return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(response.success(false).message("Report email was already sent for this audit").build());
            case IN_PROGRESS:
                return ResponseEntity.ok(response.success(true)
                    .message("Audit is being processed right now; it was re-opened and will be picked up again if needed")
                    .build());
            default:
                return ResponseEntity.ok(response.success(true).message("Audit queued for processing").build());
        }
    }

    @PostMapping("/audits/{auditId}/complete")
    public ResponseEntity<AdminActionResponse> completeAudit(@PathVariable UUID auditId) {
        log.info("[ADMIN] Reconcile requested | auditId={}", auditId);
        Optional<AuditEvidence> evidence = queueService.complete(auditId);
        if (evidence.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(AdminActionResponse.builder()
                .success(false)
                .action("complete")
                .auditId(auditId)
                .message("Audit not found")
                .build());
        }

        AuditEvidence e = evidence.get();
        return ResponseEntity.ok(AdminActionResponse.builder()
            .success(e.isComplete())
            .action("complete")
            .auditId(auditId)
            .message(e.isComplete()
                ? "Audit and queue entries marked completed"
                : "No report or sent email found; audit left as " + e.getStatus().getValue())
            .audit(AdminActionResponse.AuditState.builder()
                .status(e.isComplete() ? "completed" : e.getStatus().getValue())
                .reportPresent(e.isReportPresent())
                .emailSent(e.getEmailMarker().isSent())
                .complete(e.isComplete())
                .build())
            .build());
    }

    @PostMapping("/queue/reclaim")
    public ResponseEntity<AdminActionResponse> reclaimStuck() {
        List<ReclaimedItem> reclaimed = stuckItemReclaimer.reclaim();
        log.info("[ADMIN] Stuck entries reclaimed | count={}", reclaimed.size());
        return ResponseEntity.ok(AdminActionResponse.builder()
            .success(true)
            .action("reclaim")
            .count(reclaimed.size())
            .stuckItemsReset(ProcessQueueResponse.StuckItem.fromAll(reclaimed))
            .build());
    }

    @PostMapping("/queue/reconcile-orphans")
    public ResponseEntity<AdminActionResponse> reconcileOrphans() {
        int queued = orphanAuditReconciler.reconcileOrphans();
        log.info("[ADMIN] Orphaned audits queued | count={}", queued);
        return ResponseEntity.ok(AdminActionResponse.builder()
            .success(true)
            .action("reconcile-orphans")
            .count(queued)
            .build());
    }
}
