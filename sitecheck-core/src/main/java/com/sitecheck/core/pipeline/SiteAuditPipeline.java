package com.sitecheck.core.pipeline;

import com.sitecheck.common.util.UrlUtils;
import com.sitecheck.data.repository.AuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Single-page audit: fetch, analyze, render. Persisting the report is left to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteAuditPipeline implements AuditPipeline {

    private final AuditRepository auditRepository;
    private final PageFetcher pageFetcher;
    private final PageAnalyzer pageAnalyzer;
    private final ReportRenderer reportRenderer;

    @Override
    public AuditReport runAudit(UUID auditId) {
        String url = auditRepository.findUrl(auditId)
            .map(UrlUtils::normalize)
            .orElseThrow(() -> new AuditPipelineException("Audit not found: " + auditId));

        log.info("[PIPELINE] Starting audit | auditId={} | url={}", auditId, url);
        long startTime = System.currentTimeMillis();

        FetchedPage page = pageFetcher.fetch(url);
        PageAnalysis analysis = pageAnalyzer.analyze(page);
        AuditReport report = reportRenderer.render(analysis);

        log.info("[PIPELINE] Audit finished | auditId={} | score={} | issues={} | durationMs={}",
            auditId, report.getOverallScore(), report.getIssues().size(), System.currentTimeMillis() - startTime);
        return report;
    }
}
