package com.sitecheck.core.pipeline;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a self-contained HTML report (inline styles only, so it survives email clients)
 * plus a plain-text twin.
 */
@Component
public class ReportRenderer {

    public AuditReport render(PageAnalysis analysis) {
        return AuditReport.builder()
            .url(analysis.getUrl())
            .html(renderHtml(analysis))
            .plaintext(renderPlaintext(analysis))
            .overallScore(analysis.getScore())
            .issues(analysis.getIssues())
            .build();
    }

    private String renderHtml(PageAnalysis analysis) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\">")
            .append("<title>Website audit for ").append(escape(analysis.getUrl())).append("</title></head>")
            .append("<body style=\"font-family: Arial, sans-serif; color: #111827; max-width: 720px; margin: 0 auto;\">")
            .append("<h1>Website audit</h1>")
            .append("<p style=\"color: #6b7280;\">").append(escape(analysis.getUrl())).append("</p>")
            .append("<div style=\"font-size: 2.5em; font-weight: bold; color: ")
            .append(scoreColor(analysis.getScore())).append(";\">")
            .append(analysis.getScore()).append("/100</div>")
            .append("<h2>Page overview</h2><table style=\"border-collapse: collapse;\">");
        row(html, "HTTP status", String.valueOf(analysis.getHttpStatus()));
        row(html, "HTTPS", analysis.isHttps() ? "Yes" : "No");
        row(html, "Title", analysis.getTitle() != null ? analysis.getTitle() : "(missing)");
        row(html, "Description", analysis.getMetaDescription() != null ? analysis.getMetaDescription() : "(missing)");
        row(html, "H1 headings", String.valueOf(analysis.getH1Count()));
        row(html, "H2 headings", String.valueOf(analysis.getH2Count()));
        row(html, "Words", String.valueOf(analysis.getWordCount()));
        row(html, "Images without alt text",
            analysis.getMissingAltText() + " of " + analysis.getTotalImages());
        html.append("</table>");

        List<AuditIssue> issues = analysis.getIssues();
        html.append("<h2>Issues found (").append(issues.size()).append(")</h2>");
        if (issues.isEmpty()) {
            html.append("<p>No issues found. Nice work.</p>");
        }
        for (AuditIssue issue : issues) {
            html.append("<div style=\"border-left: 4px solid ").append(severityColor(issue.getSeverity()))
                .append("; padding: 8px 12px; margin: 12px 0;\">")
                .append("<strong>").append(escape(issue.getTitle())).append("</strong> ")
                .append("<span style=\"color: #6b7280; font-size: 0.85em;\">")
                .append(issue.getSeverity().name().toLowerCase()).append("</span>")
                .append("<p>").append(escape(issue.getExplanation())).append("</p>")
                .append("<p><em>How to fix:</em> ").append(escape(issue.getSuggestedFix())).append("</p>")
                .append("</div>");
        }
        html.append("</body></html>");
        return html.toString();
    }

    private String renderPlaintext(PageAnalysis analysis) {
        StringBuilder text = new StringBuilder();
        text.append("Website audit for ").append(analysis.getUrl()).append('\n')
            .append("Overall score: ").append(analysis.getScore()).append("/100\n\n");
        for (AuditIssue issue : analysis.getIssues()) {
            text.append("- [").append(issue.getSeverity()).append("] ").append(issue.getTitle()).append('\n')
                .append("  ").append(issue.getExplanation()).append('\n')
                .append("  Fix: ").append(issue.getSuggestedFix()).append('\n');
        }
        return text.toString();
    }

    private void row(StringBuilder html, String label, String value) {
        html.append("<tr><td style=\"padding: 4px 12px 4px 0; color: #6b7280;\">").append(escape(label))
            .append("</td><td style=\"padding: 4px 0;\">").append(escape(value)).append("</td></tr>");
    }

    private String scoreColor(int score) {
        if (score >= 80) return "#16a34a";
        if (score >= 60) return "#ca8a04";
        return "#dc2626";
    }

    private String severityColor(AuditIssue.Severity severity) {
        switch (severity) {
            case HIGH:
                return "#dc2626";
            case MEDIUM:
                return "#ca8a04";
            default:
                return "#2563eb";
        }
    }

    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }
}
