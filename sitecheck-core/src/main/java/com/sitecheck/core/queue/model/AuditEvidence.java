package com.sitecheck.core.queue.model;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.common.model.EmailMarker;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Snapshot of the fields of an audit that decide whether it is done.
 */
@Value
@Builder
public class AuditEvidence {
    UUID auditId;
    AuditStatus status;
    boolean reportPresent;
    EmailMarker emailMarker;

    /**
     * Any single piece of success evidence is enough.
     */
    public boolean isComplete() {
        return reportPresent || emailMarker.isSent() || status == AuditStatus.COMPLETED;
    }

    /**
     * Strong form used before claiming: nothing is left to do for this audit.
     */
    public boolean isSettled() {
        return (reportPresent && emailMarker.isSent()) || status == AuditStatus.COMPLETED;
    }
}
