package com.sitecheck.core.queue;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.common.model.EmailMarker;
import com.sitecheck.data.entity.Audit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EmailSendGuardTest extends QueueIntegrationTest {

    @Autowired
    private EmailSendGuard guard;

    @Test
    void onlyFirstReserverWins() {
        Audit audit = fixtures.audit(AuditStatus.RUNNING, "<html/>", null);

        EmailSendGuard.Reservation first = guard.reserve(audit.getId(), "tick-a");
        EmailSendGuard.Reservation second = guard.reserve(audit.getId(), "tick-b");

        assertThat(first.isReserved()).isTrue();
        assertThat(first.getMarker().getToken()).isEqualTo("tick-a");
        assertThat(second.getDecision()).isEqualTo(EmailSendGuard.Decision.IN_FLIGHT);
        assertThat(guard.isHeld(audit.getId(), first.getMarker())).isTrue();
    }

    @Test
    void committedMarkerBlocksFurtherSends() {
        Audit audit = fixtures.audit(AuditStatus.RUNNING, "<html/>", null);
        EmailSendGuard.Reservation reservation = guard.reserve(audit.getId(), "tick-a");

        assertThat(guard.commit(audit.getId(), reservation.getMarker())).isTrue();
        assertThat(guard.reserve(audit.getId(), "tick-b").getDecision())
            .isEqualTo(EmailSendGuard.Decision.ALREADY_SENT);
    }

    @Test
    void commitAfterTakeoverStillRecordsTheSend() {
        EmailMarker lost = EmailMarker.reservation(Instant.now().minus(Duration.ofMinutes(30)), "tick-slow");
        EmailMarker current = EmailMarker.reservation(Instant.now(), "tick-new");
        Audit audit = fixtures.audit(AuditStatus.RUNNING, "<html/>", current.getRaw());

        assertThat(guard.isHeld(audit.getId(), lost)).isFalse();
        assertThat(guard.commit(audit.getId(), lost)).isTrue();
        assertThat(fixtures.reload(audit.getId()).getParsedEmailMarker().isSent()).isTrue();
    }

    @Test
    void releaseReturnsMarkerToEmpty() {
        Audit audit = fixtures.audit(AuditStatus.RUNNING, null, null);
        EmailSendGuard.Reservation reservation = guard.reserve(audit.getId(), "tick-a");

        guard.release(audit.getId(), reservation.getMarker());

        assertThat(fixtures.reload(audit.getId()).getEmailMarker()).isNull();
        assertThat(guard.reserve(audit.getId(), "tick-b").isReserved()).isTrue();
    }

    @Test
    void missingAudit() {
        assertThat(guard.reserve(UUID.randomUUID(), "tick-a").getDecision())
            .isEqualTo(EmailSendGuard.Decision.AUDIT_MISSING);
    }
}
