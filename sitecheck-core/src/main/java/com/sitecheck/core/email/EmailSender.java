package com.sitecheck.core.email;

import java.util.UUID;

/**
 * Delivers a finished report to the customer. Either returns normally (accepted by the
 * provider) or throws.
 */
public interface EmailSender {

    void sendReportEmail(String toAddress, String targetUrl, UUID auditId, String reportHtml);
}
