package com.sitecheck.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sitecheck.core.queue.model.ReclaimedItem;
import com.sitecheck.core.queue.model.TickResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessQueueResponse {
    private boolean processed;
    private UUID auditId;
    private boolean willRetry;
    private boolean continuing;
    private String outcome;
    private String message;
    private List<StuckItem> stuckItemsReset;
    private Integer orphansQueued;

    public static ProcessQueueResponse from(TickResult result) {
        return ProcessQueueResponse.builder()
            .processed(result.isProcessed())
            .auditId(result.getAuditId())
            .willRetry(result.isWillRetry())
            .continuing(result.isContinuing())
            .outcome(result.getOutcome().name().toLowerCase())
            .message(result.getMessage())
            .stuckItemsReset(StuckItem.fromAll(result.getStuckItemsReset()))
            .orphansQueued(result.getOrphansQueued() > 0 ? result.getOrphansQueued() : null)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StuckItem {
        private UUID id;
        private UUID auditId;
        private String newStatus;
        private int retryCount;

        public static List<StuckItem> fromAll(List<ReclaimedItem> items) {
            return items.stream()
                .map(item -> StuckItem.builder()
                    .id(item.getJobId())
                    .auditId(item.getAuditId())
                    .newStatus(item.getNewStatus().getValue())
                    .retryCount(item.getRetryCount())
                    .build())
                .collect(Collectors.toList());
        }
    }
}
