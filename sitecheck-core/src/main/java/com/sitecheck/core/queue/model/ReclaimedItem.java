package com.sitecheck.core.queue.model;

import com.sitecheck.common.constants.QueueStatus;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class ReclaimedItem {
    private UUID jobId;
    private UUID auditId;
    private QueueStatus newStatus; // pending, failed, or completed when evidence showed success
    private int retryCount;
}
