package com.sitecheck.core.pipeline;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AuditIssue {

    public enum Severity { HIGH, MEDIUM, LOW }

    private String title;
    private Severity severity;
    private String explanation;
    private String suggestedFix;
    private int penalty;
}
