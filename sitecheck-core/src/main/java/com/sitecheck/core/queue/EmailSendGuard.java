package com.sitecheck.core.queue;

import com.sitecheck.common.model.EmailMarker;
import com.sitecheck.data.entity.Audit;
import com.sitecheck.data.repository.AuditRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Reservation and commit of the email marker. A sender must hold a reservation it wrote
 * itself before calling the email provider.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailSendGuard {

    private final AuditRepository auditRepository;
    private final QueueProperties properties;

    public enum Decision { RESERVED, ALREADY_SENT, IN_FLIGHT, AUDIT_MISSING }

    @Getter
    public static final class Reservation {
        private final Decision decision;
        private final EmailMarker marker;

        private Reservation(Decision decision, EmailMarker marker) {
            this.decision = decision;
            this.marker = marker;
        }

        public boolean isReserved() {
            return decision == Decision.RESERVED;
        }
    }

    /**
     * Try to take the right to send the email of an audit.
     *
     * <p>An empty marker is reserved directly. A reservation older than the grace window is
     * taken over by a compare-and-swap on its exact value. A committed marker or a fresh
     * reservation held by someone else is left alone.
     */
    public Reservation reserve(UUID auditId, String token) {
        Instant now = Instant.now();
        EmailMarker current = readMarker(auditId);
        if (current == null) {
            return new Reservation(Decision.AUDIT_MISSING, null);
        }
        if (current.isSent()) {
            return new Reservation(Decision.ALREADY_SENT, current);
        }
        if (current.isFreshReservation(now, properties.getReservationGraceWindow())) {
            log.info("[EMAIL-GUARD] Send in flight elsewhere | auditId={} | marker={}", auditId, current);
            return new Reservation(Decision.IN_FLIGHT, current);
        }

        EmailMarker mine = EmailMarker.reservation(now, token);
        int updated = current.isNone()
            ? auditRepository.reserveEmail(auditId, mine.getRaw())
            : auditRepository.takeOverEmailReservation(auditId, current.getRaw(), mine.getRaw());

        if (updated == 1) {
            if (current.isReserved()) {
                log.warn("[EMAIL-GUARD] Took over abandoned reservation | auditId={} | previous={}", auditId, current);
            }
            return new Reservation(Decision.RESERVED, mine);
        }

        // lost the swap; report what won
        EmailMarker winner = readMarker(auditId);
        if (winner == null) {
            return new Reservation(Decision.AUDIT_MISSING, null);
        }
        return new Reservation(winner.isSent() ? Decision.ALREADY_SENT : Decision.IN_FLIGHT, winner);
    }

    /**
     * Replace our reservation with the send time. Falls back to an unconditional commit
     * when the reservation was taken over meanwhile, since the email did go out.
     */
    public boolean commit(UUID auditId, EmailMarker reservation) {
        String sent = EmailMarker.sent(Instant.now()).getRaw();
        if (auditRepository.commitEmail(auditId, reservation.getRaw(), sent) == 1) {
            return true;
        }
        int forced = auditRepository.forceCommitEmail(auditId, sent);
        if (forced == 1) {
            log.warn("[EMAIL-GUARD] Reservation lost before commit, recorded send anyway | auditId={}", auditId);
        } else {
            log.warn("[EMAIL-GUARD] Email already recorded as sent by another invocation | auditId={}", auditId);
        }
        return forced == 1;
    }

    /**
     * Clear our reservation after a failed send. A no-op when it is no longer ours.
     */
    public void release(UUID auditId, EmailMarker reservation) {
        int released = auditRepository.releaseEmailReservation(auditId, reservation.getRaw());
        log.debug("[EMAIL-GUARD] Reservation release | auditId={} | released={}", auditId, released == 1);
    }

    /**
     * Whether the marker still holds exactly this reservation.
     */
    public boolean isHeld(UUID auditId, EmailMarker reservation) {
        return reservation.equals(readMarker(auditId));
    }

    private EmailMarker readMarker(UUID auditId) {
        return auditRepository.findById(auditId).map(Audit::getParsedEmailMarker).orElse(null);
    }
}
