package com.sitecheck.core.queue;

import com.sitecheck.core.email.EmailSender;
import com.sitecheck.core.pipeline.AuditPipeline;
import com.sitecheck.core.pipeline.AuditReport;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.util.List;

/**
 * Shared context for queue tests against the in-memory database, with the audit pipeline
 * and the email provider mocked.
 */
@SpringBootTest
@Import(QueueFixtures.class)
abstract class QueueIntegrationTest {

    protected static final String REPORT_HTML = "<html><body>report</body></html>";

    @Autowired
    protected QueueFixtures fixtures;

    @Autowired
    protected QueueProperties queueProperties;

    @MockBean
    protected AuditPipeline auditPipeline;

    @MockBean
    protected EmailSender emailSender;

    @BeforeEach
    void clearDatabase() {
        fixtures.clear();
    }

    protected static AuditReport report() {
        return AuditReport.builder()
            .url("https://example.com")
            .html(REPORT_HTML)
            .plaintext("report")
            .overallScore(80)
            .issues(List.of())
            .build();
    }
}
