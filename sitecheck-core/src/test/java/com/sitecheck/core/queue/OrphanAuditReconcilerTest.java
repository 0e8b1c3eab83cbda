package com.sitecheck.core.queue;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.common.model.EmailMarker;
import com.sitecheck.data.entity.Audit;
import com.sitecheck.data.repository.AuditQueueRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanAuditReconcilerTest extends QueueIntegrationTest {

    @Autowired
    private OrphanAuditReconciler orphanReconciler;

    @Autowired
    private AuditQueueRepository queueRepository;

    @Test
    void queuesEachOpenAuditOnceAcrossSweeps() {
        Audit pending = fixtures.pendingAudit();
        Audit running = fixtures.audit(AuditStatus.RUNNING, null, null);

        assertThat(orphanReconciler.reconcileOrphans()).isEqualTo(2);
        assertThat(orphanReconciler.reconcileOrphans()).isZero();

        assertThat(queueRepository.findByAuditIdOrderByCreatedAtDesc(pending.getId()))
            .singleElement()
            .satisfies(item -> assertThat(item.getStatus()).isEqualTo(QueueStatus.PENDING));
        assertThat(queueRepository.findByAuditIdOrderByCreatedAtDesc(running.getId())).hasSize(1);
    }

    @Test
    void ignoresFinishedAndEmailedAudits() {
        fixtures.audit(AuditStatus.COMPLETED, "<html/>", null);
        fixtures.audit(AuditStatus.FAILED, null, null);
        fixtures.audit(AuditStatus.RUNNING, null, EmailMarker.sent(Instant.now()).getRaw());

        assertThat(orphanReconciler.reconcileOrphans()).isZero();
        assertThat(queueRepository.count()).isZero();
    }
}
