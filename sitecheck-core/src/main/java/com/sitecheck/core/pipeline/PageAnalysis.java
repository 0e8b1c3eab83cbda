package com.sitecheck.core.pipeline;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PageAnalysis {
    private String url;
    private int httpStatus;
    private boolean https;
    private String title;
    private String metaDescription;
    private int h1Count;
    private int h2Count;
    private int wordCount;
    private int totalImages;
    private int missingAltText;
    private boolean hasViewport;
    private int score;
    private List<AuditIssue> issues;
}
