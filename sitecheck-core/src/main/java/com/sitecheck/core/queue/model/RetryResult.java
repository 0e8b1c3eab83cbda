package com.sitecheck.core.queue.model;

public enum RetryResult {
    REQUEUED,
    CREATED,
    /** A claim is currently held; the audit was re-opened but no entry changed. */
    IN_PROGRESS,
    EMAIL_ALREADY_SENT,
    NOT_FOUND
}
