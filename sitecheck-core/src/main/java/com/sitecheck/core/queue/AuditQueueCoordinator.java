package com.sitecheck.core.queue;

import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.common.model.EmailMarker;
import com.sitecheck.common.util.ErrorMessages;
import com.sitecheck.core.email.EmailDeliveryException;
import com.sitecheck.core.email.EmailSender;
import com.sitecheck.core.pipeline.AuditPipeline;
import com.sitecheck.core.pipeline.AuditPipelineException;
import com.sitecheck.core.pipeline.AuditReport;
import com.sitecheck.core.queue.model.AuditEvidence;
import com.sitecheck.core.queue.model.ReclaimedItem;
import com.sitecheck.core.queue.model.TickOutcome;
import com.sitecheck.core.queue.model.TickResult;
import com.sitecheck.data.entity.Audit;
import com.sitecheck.data.entity.AuditQueueItem;
import com.sitecheck.data.repository.AuditQueueRepository;
import com.sitecheck.data.repository.AuditRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One tick of the audit queue: pick the oldest claimable entry, claim it, produce the
 * report, send the email exactly once and record the outcome.
 *
 * <p>Invocations share nothing but the database. Every state change is a conditional
 * update whose row count is checked, so overlapping ticks either see each other's claims
 * or lose the swap and back off. Nothing here holds a transaction open; each repository
 * call commits on its own.
 */
@Service
@Slf4j
public class AuditQueueCoordinator {

    private final AuditQueueRepository queueRepository;
    private final AuditRepository auditRepository;
    private final AuditReconciler auditReconciler;
    private final EmailSendGuard emailSendGuard;
    private final FailureClassifier failureClassifier;
    private final StuckItemReclaimer stuckItemReclaimer;
    private final OrphanAuditReconciler orphanAuditReconciler;
    private final AuditErrorLog auditErrorLog;
    private final AuditPipeline auditPipeline;
    private final EmailSender emailSender;
    private final QueueProperties properties;
    private final ExecutorService auditExecutor;

    public AuditQueueCoordinator(
        AuditQueueRepository queueRepository,
        AuditRepository auditRepository,
        AuditReconciler auditReconciler,
        EmailSendGuard emailSendGuard,
        FailureClassifier failureClassifier,
        StuckItemReclaimer stuckItemReclaimer,
        OrphanAuditReconciler orphanAuditReconciler,
        AuditErrorLog auditErrorLog,
        AuditPipeline auditPipeline,
        EmailSender emailSender,
        QueueProperties properties,
        @Qualifier("auditExecutor") ExecutorService auditExecutor
    ) {
        this.queueRepository = queueRepository;
        this.auditRepository = auditRepository;
        this.auditReconciler = auditReconciler;
        this.emailSendGuard = emailSendGuard;
        this.failureClassifier = failureClassifier;
        this.stuckItemReclaimer = stuckItemReclaimer;
        this.orphanAuditReconciler = orphanAuditReconciler;
        this.auditErrorLog = auditErrorLog;
        this.auditPipeline = auditPipeline;
        this.emailSender = emailSender;
        this.properties = properties;
        this.auditExecutor = auditExecutor;
    }

    public TickResult processNext() {
        Instant tickStart = Instant.now();
        String token = "tick-" + UUID.randomUUID().toString().substring(0, 8);

        List<AuditQueueItem> candidates = queueRepository.findByStatusOrderByCreatedAtAsc(
            QueueStatus.PENDING, PageRequest.of(0, properties.getBatchSize()));

        if (candidates.isEmpty()) {
            int orphans = orphanAuditReconciler.reconcileOrphans();
            List<ReclaimedItem> reclaimed = stuckItemReclaimer.reclaim();
            log.debug("[QUEUE] No pending entries | token={} | orphansQueued={} | stuckReset={}",
                token, orphans, reclaimed.size());
            return TickResult.builder()
                .outcome(TickOutcome.IDLE)
                .orphansQueued(orphans)
                .stuckItemsReset(reclaimed)
                .message(orphans > 0 ? "Queued " + orphans + " orphaned audits" : "No pending audits in queue")
                .build();
        }

        for (AuditQueueItem candidate : candidates) {
            if (isClaimable(candidate)) {
                return dispatch(candidate, token, tickStart);
            }
        }

        List<ReclaimedItem> reclaimed = stuckItemReclaimer.reclaim();
        log.info("[QUEUE] No claimable entry among {} pending | token={} | stuckReset={}",
            candidates.size(), token, reclaimed.size());
        return TickResult.builder()
            .outcome(TickOutcome.NOTHING_CLAIMABLE)
            .stuckItemsReset(reclaimed)
            .message("No claimable audits in queue")
            .build();
    }

    /**
     * Fresh re-check of a candidate from the range query. Settled audits are closed out
     * here without claiming.
     */
    private boolean isClaimable(AuditQueueItem candidate) {
        UUID jobId = candidate.getId();
        UUID auditId = candidate.getAuditId();

        boolean stillPending = queueRepository.findCurrentStatus(jobId)
            .map(QueueStatus.PENDING.getValue()::equals)
            .orElse(false);
        if (!stillPending) {
            log.debug("[QUEUE] Candidate no longer pending, skipping | jobId={}", jobId);
            return false;
        }

        Optional<AuditEvidence> evidence = auditReconciler.readEvidence(auditId);
        if (evidence.isEmpty()) {
            queueRepository.failPending(jobId, "Audit not found", Instant.now());
            log.warn("[QUEUE] Queue entry points at a missing audit, marked failed | jobId={} | auditId={}",
                jobId, auditId);
            return false;
        }

        if (evidence.get().isSettled()) {
            auditReconciler.reconcile(auditId, jobId);
            log.info("[QUEUE] Audit already done, entry closed without work | jobId={} | auditId={}",
                jobId, auditId);
            return false;
        }

        EmailMarker marker = evidence.get().getEmailMarker();
        if (marker.isFreshReservation(Instant.now(), properties.getReservationGraceWindow())) {
            log.info("[QUEUE] Email send in flight for audit, skipping | jobId={} | auditId={} | marker={}",
                jobId, auditId, marker);
            return false;
        }
        return true;
    }

    private TickResult dispatch(AuditQueueItem candidate, String token, Instant tickStart) {
        UUID jobId = candidate.getId();
        UUID auditId = candidate.getAuditId();

        if (queueRepository.claim(jobId, token, Instant.now()) == 0) {
            log.info("[QUEUE] Claim lost to another invocation | jobId={} | token={}", jobId, token);
            return TickResult.of(TickOutcome.RACE_LOST, auditId, jobId, "Queue entry was claimed by another invocation");
        }

        int attempt = queueRepository.findById(jobId)
            .map(AuditQueueItem::getRetryCount)
            .orElse(candidate.getRetryCount() + 1);
        log.info("[QUEUE] Claimed | jobId={} | auditId={} | attempt={}/{} | token={}",
            jobId, auditId, attempt, properties.getMaxRetries(), token);
        auditRepository.markRunning(auditId);

        EmailSendGuard.Reservation reservation = emailSendGuard.reserve(auditId, token);
        switch (reservation.getDecision()) {
            case ALREADY_SENT:
                auditReconciler.reconcile(auditId, jobId);
                return TickResult.of(TickOutcome.ALREADY_COMPLETED, auditId, jobId,
                    "Email was already sent, records reconciled");
            case IN_FLIGHT:
                queueRepository.releaseClaim(jobId, token);
                return TickResult.of(TickOutcome.DEFERRED, auditId, jobId,
                    "Another invocation is sending the email for this audit");
            case AUDIT_MISSING:
                queueRepository.failClaimed(jobId, token, "Audit not found", Instant.now());
                return TickResult.of(TickOutcome.FAILED, auditId, jobId, "Audit not found");
            default:
                break;
        }

        ClaimedJob job = new ClaimedJob(jobId, auditId, token, attempt, reservation.getMarker(), tickStart);
        return runWithDeadline(job);
    }

    /**
     * Race the audit against the soft deadline. Losing the race never cancels the work:
     * it finishes on the audit executor and records its own outcome.
     */
    private TickResult runWithDeadline(ClaimedJob job) {
        Duration remaining = properties.getSoftDeadline().minus(Duration.between(job.tickStart, Instant.now()));
        CompletableFuture<Void> unit = CompletableFuture.runAsync(() -> deliver(job), auditExecutor);

        try {
            unit.get(Math.max(0, remaining.toMillis()), TimeUnit.MILLISECONDS);
            return finishSuccess(job);
        } catch (TimeoutException e) {
            log.warn("[QUEUE] Soft deadline reached, audit continues in background | jobId={} | auditId={} | deadline={}",
                job.jobId, job.auditId, properties.getSoftDeadline());
            finishInBackground(unit, job);
            return TickResult.of(TickOutcome.CONTINUING, job.auditId, job.jobId,
                "Audit is still running and will finish in the background");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finishInBackground(unit, job);
            return TickResult.of(TickOutcome.CONTINUING, job.auditId, job.jobId,
                "Tick interrupted, audit continues in the background");
        } catch (ExecutionException e) {
            return finishFailure(job, unwrap(e));
        }
    }

    /**
     * Produce the report if there is none yet, then send it while still holding the
     * email reservation.
     */
    private void deliver(ClaimedJob job) {
        Audit audit = auditRepository.findById(job.auditId)
            .orElseThrow(() -> new AuditPipelineException("Audit not found: " + job.auditId));

        String reportHtml = audit.getFormattedReportHtml();
        if (!audit.hasReport()) {
            AuditReport report = auditPipeline.runAudit(job.auditId);
            auditRepository.storeReport(job.auditId, report.getHtml(), report.getPlaintext());
            reportHtml = report.getHtml();
            log.info("[QUEUE] Report stored | auditId={} | score={}", job.auditId, report.getOverallScore());
        } else {
            log.info("[QUEUE] Report already stored, sending email only | auditId={}", job.auditId);
        }

        if (!emailSendGuard.isHeld(job.auditId, job.reservation)) {
            log.warn("[QUEUE] Email reservation no longer held, not sending | auditId={} | token={}",
                job.auditId, job.token);
            return;
        }

        String customerEmail = auditRepository.findCustomerEmail(job.auditId)
            .orElseThrow(() -> new EmailDeliveryException("No customer email for audit " + job.auditId));
        emailSender.sendReportEmail(customerEmail, audit.getUrl(), job.auditId, reportHtml);
        emailSendGuard.commit(job.auditId, job.reservation);
        log.info("[QUEUE] Report email sent | auditId={}", job.auditId);
    }

    private TickResult finishSuccess(ClaimedJob job) {
        Optional<AuditEvidence> evidence = auditReconciler.reconcile(job.auditId, job.jobId);
        if (evidence.map(AuditEvidence::isComplete).orElse(false)) {
            log.info("[QUEUE] Audit completed | jobId={} | auditId={} | durationMs={}",
                job.jobId, job.auditId, Duration.between(job.tickStart, Instant.now()).toMillis());
            return TickResult.of(TickOutcome.COMPLETED, job.auditId, job.jobId, "Audit completed");
        }
        return finishFailure(job, new IllegalStateException("Audit finished without a stored report"));
    }

    private TickResult finishFailure(ClaimedJob job, Throwable error) {
        emailSendGuard.release(job.auditId, job.reservation);
        String message = ErrorMessages.truncate(ErrorMessages.describe(error));

        Optional<AuditEvidence> evidence = auditReconciler.reconcile(job.auditId, job.jobId);
        if (evidence.map(AuditEvidence::isComplete).orElse(false)) {
            if (evidence.get().getEmailMarker().isSent()) {
                return TickResult.of(TickOutcome.COMPLETED, job.auditId, job.jobId, "Audit completed");
            }
            log.error("[QUEUE] Report stored but email not delivered, use the admin retry to resend | jobId={} | auditId={} | error={}",
                job.jobId, job.auditId, message, error);
            return TickResult.of(TickOutcome.EMAIL_FAILED, job.auditId, job.jobId,
                "Report saved but the email could not be sent: " + message);
        }

        boolean permanent = failureClassifier.isPermanent(error);
        if (permanent || job.attempt >= properties.getMaxRetries()) {
            int updated = queueRepository.failClaimed(job.jobId, job.token, message, Instant.now());
            if (updated == 1) {
                String note = permanent
                    ? "Permanent error, not retried"
                    : "Failed after " + job.attempt + " attempts";
                auditRepository.markFailed(job.auditId, auditErrorLog.build(message, false, note));
                log.error("[QUEUE] Audit failed | jobId={} | auditId={} | permanent={} | attempts={}/{} | error={}",
                    job.jobId, job.auditId, permanent, job.attempt, properties.getMaxRetries(), message);
            } else {
                log.warn("[QUEUE] Claim no longer held, failure not recorded | jobId={} | token={}", job.jobId, job.token);
            }
            return TickResult.of(TickOutcome.FAILED, job.auditId, job.jobId, message);
        }

        int updated = queueRepository.requeueClaimed(job.jobId, job.token, message);
        if (updated == 0) {
            log.warn("[QUEUE] Claim no longer held, retry not scheduled here | jobId={} | token={}", job.jobId, job.token);
        } else {
            log.warn("[QUEUE] Audit failed, will retry | jobId={} | auditId={} | attempt={}/{} | error={}",
                job.jobId, job.auditId, job.attempt, properties.getMaxRetries(), message);
        }
        TickResult result = TickResult.of(TickOutcome.RETRY_SCHEDULED, job.auditId, job.jobId, message);
        result.setWillRetry(true);
        return result;
    }

    private void finishInBackground(CompletableFuture<Void> unit, ClaimedJob job) {
        unit.whenComplete((ignored, error) -> {
            try {
                TickResult result = error == null ? finishSuccess(job) : finishFailure(job, unwrap(error));
                log.info("[QUEUE] Background audit finished | jobId={} | auditId={} | outcome={}",
                    job.jobId, job.auditId, result.getOutcome());
            } catch (Exception e) {
                log.error("[QUEUE] Could not record background outcome, reclaimer will recover it | jobId={}",
                    job.jobId, e);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class ClaimedJob {
        private final UUID jobId;
        private final UUID auditId;
        private final String token;
        private final int attempt;
        private final EmailMarker reservation;
        private final Instant tickStart;

        private ClaimedJob(UUID jobId, UUID auditId, String token, int attempt, EmailMarker reservation, Instant tickStart) {
            this.jobId = jobId;
            this.auditId = auditId;
            this.token = token;
            this.attempt = attempt;
            this.reservation = reservation;
            this.tickStart = tickStart;
        }
    }
}
