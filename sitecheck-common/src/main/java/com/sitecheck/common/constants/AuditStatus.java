package com.sitecheck.common.constants;

import java.util.Arrays;

/**
 * Customer-facing lifecycle of an audit. Stored in lower case.
 */
public enum AuditStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    AuditStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Still owned by the queue: no outcome has been recorded yet.
     */
    public boolean isOpen() {
        return this == PENDING || this == RUNNING;
    }

    public static AuditStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown audit status: " + value));
    }
}
