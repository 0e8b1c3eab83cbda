package com.sitecheck.core.queue;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.data.entity.Audit;
import com.sitecheck.data.entity.AuditQueueItem;
import com.sitecheck.data.entity.Customer;
import com.sitecheck.data.repository.AuditQueueRepository;
import com.sitecheck.data.repository.AuditRepository;
import com.sitecheck.data.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.test.context.TestComponent;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds audits and queue entries directly in the database.
 */
@TestComponent
@RequiredArgsConstructor
public class QueueFixtures {

    private final CustomerRepository customerRepository;
    private final AuditRepository auditRepository;
    private final AuditQueueRepository queueRepository;

    public void clear() {
        queueRepository.deleteAll();
        auditRepository.deleteAll();
        customerRepository.deleteAll();
    }

    public Audit audit(AuditStatus status, String reportHtml, String emailMarker) {
        Customer customer = customerRepository.save(Customer.builder()
            .email("owner-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com")
            .name("Owner")
            .build());
        return auditRepository.save(Audit.builder()
            .customer(customer)
            .url("https://example.com")
            .status(status)
            .formattedReportHtml(reportHtml)
            .emailMarker(emailMarker)
            .build());
    }

    public Audit pendingAudit() {
        return audit(AuditStatus.PENDING, null, null);
    }

    public AuditQueueItem pendingItem(UUID auditId, Instant createdAt) {
        return queueRepository.save(AuditQueueItem.builder()
            .auditId(auditId)
            .status(QueueStatus.PENDING)
            .createdAt(createdAt)
            .build());
    }

    public AuditQueueItem processingItem(UUID auditId, Instant startedAt, int retryCount) {
        return queueRepository.save(AuditQueueItem.builder()
            .auditId(auditId)
            .status(QueueStatus.PROCESSING)
            .startedAt(startedAt)
            .retryCount(retryCount)
            .lockedBy("tick-dead")
            .build());
    }

    public AuditQueueItem item(UUID id) {
        return queueRepository.findById(id).orElseThrow();
    }

    public Audit reload(UUID auditId) {
        return auditRepository.findById(auditId).orElseThrow();
    }
}
