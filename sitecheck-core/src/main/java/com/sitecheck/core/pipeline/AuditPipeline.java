package com.sitecheck.core.pipeline;

import java.util.UUID;

/**
 * Produces the report of one audit. May take from under a second to several minutes and
 * reports no partial progress.
 */
public interface AuditPipeline {

    /**
     * @throws RuntimeException when the site cannot be analyzed; a
     *         {@link org.springframework.web.reactive.function.client.WebClientResponseException}
     *         or a connection failure in the cause chain tells the queue whether a retry can help
     */
    AuditReport runAudit(UUID auditId);
}
