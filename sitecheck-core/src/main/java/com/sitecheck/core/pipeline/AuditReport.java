package com.sitecheck.core.pipeline;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AuditReport {
    private String url;
    private String html;
    private String plaintext;
    private int overallScore;
    private List<AuditIssue> issues;
}
