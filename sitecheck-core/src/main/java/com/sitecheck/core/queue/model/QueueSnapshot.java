package com.sitecheck.core.queue.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class QueueSnapshot {
    private Map<String, Long> queueCounts;
    private Map<String, Long> auditCounts;
    private List<StuckEntry> stuckItems;
    private List<UUID> auditsWithoutReport;
    private Instant generatedAt;

    @Data
    @Builder
    public static class StuckEntry {
        private UUID jobId;
        private UUID auditId;
        private Instant startedAt;
        private int retryCount;
        private long minutesProcessing;
    }
}
