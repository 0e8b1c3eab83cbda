package com.sitecheck.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdminActionResponse {
    private boolean success;
    private String action;
    private UUID auditId;
    private String result;
    private String message;
    private Integer count;
    private AuditState audit;
    private List<ProcessQueueResponse.StuckItem> stuckItemsReset;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuditState {
        private String status;
        private boolean reportPresent;
        private boolean emailSent;
        private boolean complete;
    }
}
