package com.sitecheck.core.queue.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class TickResult {
    private TickOutcome outcome;
    private UUID auditId;
    private UUID jobId;
    private boolean willRetry;
    private String message;
    @Builder.Default
    private List<ReclaimedItem> stuckItemsReset = List.of();
    private int orphansQueued;

    public boolean isProcessed() {
        return outcome != null && outcome.isProcessed();
    }

    public boolean isContinuing() {
        return outcome == TickOutcome.CONTINUING;
    }

    public static TickResult of(TickOutcome outcome, UUID auditId, UUID jobId, String message) {
        return TickResult.builder()
            .outcome(outcome)
            .auditId(auditId)
            .jobId(jobId)
            .message(message)
            .build();
    }
}
