package com.sitecheck.common.constants;

import java.util.Arrays;

/**
 * State of one queue entry.
 * <pre>
 * pending -> processing -> completed | failed
 * processing -> pending   (stuck item reset, claim release)
 * failed -> pending       (admin retry)
 * </pre>
 */
public enum QueueStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    QueueStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static QueueStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown queue status: " + value));
    }
}
