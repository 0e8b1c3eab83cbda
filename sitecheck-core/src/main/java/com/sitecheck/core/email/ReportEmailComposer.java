package com.sitecheck.core.email;

import com.sitecheck.common.util.UrlUtils;
import com.sitecheck.core.pipeline.ReportRenderer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class ReportEmailComposer {

    private final EmailProperties properties;

    public String subject(String targetUrl) {
        String domain = UrlUtils.host(UrlUtils.normalize(targetUrl));
        return "Your SEO CheckSite Report for " + (domain.isEmpty() ? targetUrl : domain) + " is Ready!";
    }

    public String reportLink(UUID auditId) {
        return properties.getSiteUrl() + "/report/" + auditId;
    }

    /**
     * Short intro with a link to the hosted report, followed by the report itself.
     */
    public String body(String targetUrl, UUID auditId, String reportHtml) {
        String link = reportLink(auditId);
        return "<div style=\"font-family: Arial, sans-serif; max-width: 720px; margin: 0 auto;\">"
            + "<p>Your website audit for <strong>" + ReportRenderer.escape(targetUrl) + "</strong> is ready.</p>"
            + "<p><a href=\"" + link + "\" style=\"background: #2563eb; color: #ffffff; padding: 10px 18px; "
            + "border-radius: 6px; text-decoration: none;\">View your report online</a></p>"
            + "<hr style=\"border: none; border-top: 1px solid #e5e7eb;\">"
            + reportHtml
            + "</div>";
    }

    public String from() {
        return properties.getFromName() != null && !properties.getFromName().isBlank()
            ? properties.getFromName() + " <" + properties.getFrom() + ">"
            : properties.getFrom();
    }
}
