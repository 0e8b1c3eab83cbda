package com.sitecheck.core.queue.model;

/**
 * What a single tick ended up doing.
 */
public enum TickOutcome {
    /** No pending entries at all; orphan sweep and reclaimer ran. */
    IDLE(false),
    /** Pending entries exist but none could be claimed this time. */
    NOTHING_CLAIMABLE(false),
    /** Another invocation claimed the chosen entry first. */
    RACE_LOST(false),
    /** Another invocation is sending the email for this audit; claim handed back. */
    DEFERRED(false),
    COMPLETED(true),
    /** The email had already been sent; only the records were brought in line. */
    ALREADY_COMPLETED(true),
    /** Report stored but the email could not be delivered. */
    EMAIL_FAILED(true),
    RETRY_SCHEDULED(true),
    FAILED(true),
    /** Soft deadline reached; the audit keeps running after the tick returns. */
    CONTINUING(true);

    private final boolean processed;

    TickOutcome(boolean processed) {
        this.processed = processed;
    }

    public boolean isProcessed() {
        return processed;
    }
}
