package com.sitecheck.common.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EmailMarkerTest {

    private static final Duration GRACE = Duration.ofMinutes(10);
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void nullAndBlankAreNone() {
        assertThat(EmailMarker.parse(null).isNone()).isTrue();
        assertThat(EmailMarker.parse("  ").isNone()).isTrue();
        assertThat(EmailMarker.none().getRaw()).isNull();
    }

    @Test
    void parsesReservationWithToken() {
        EmailMarker marker = EmailMarker.parse("sending:2025-03-01T11:55:00Z:tick-1a2b3c4d");

        assertThat(marker.isReserved()).isTrue();
        assertThat(marker.getTimestamp()).isEqualTo(Instant.parse("2025-03-01T11:55:00Z"));
        assertThat(marker.getToken()).isEqualTo("tick-1a2b3c4d");
    }

    @Test
    void reservationRawValueParsesBackToSameMarker() {
        EmailMarker reservation = EmailMarker.reservation(NOW, "abc12345");

        assertThat(reservation.getRaw()).isEqualTo("sending:2025-03-01T12:00:00Z:abc12345");
        assertThat(EmailMarker.parse(reservation.getRaw())).isEqualTo(reservation);
    }

    @Test
    void generatedTokensDiffer() {
        assertThat(EmailMarker.reservation(NOW).getRaw()).isNotEqualTo(EmailMarker.reservation(NOW).getRaw());
    }

    @Test
    void plainInstantIsSent() {
        EmailMarker marker = EmailMarker.parse("2025-03-01T12:00:00Z");

        assertThat(marker.isSent()).isTrue();
        assertThat(marker.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void unreadableValueCountsAsSent() {
        EmailMarker marker = EmailMarker.parse("yesterday");

        assertThat(marker.isSent()).isTrue();
        assertThat(marker.getTimestamp()).isNull();
    }

    @Test
    void unreadableReservationIsAbandoned() {
        EmailMarker marker = EmailMarker.parse("sending:garbage");

        assertThat(marker.isReserved()).isTrue();
        assertThat(marker.isAbandonedReservation(NOW, GRACE)).isTrue();
    }

    @Test
    void reservationFreshnessFollowsGraceWindow() {
        EmailMarker young = EmailMarker.reservation(NOW.minus(Duration.ofMinutes(9)), "a");
        EmailMarker old = EmailMarker.reservation(NOW.minus(Duration.ofMinutes(11)), "b");

        assertThat(young.isFreshReservation(NOW, GRACE)).isTrue();
        assertThat(old.isFreshReservation(NOW, GRACE)).isFalse();
        assertThat(old.isAbandonedReservation(NOW, GRACE)).isTrue();
        assertThat(EmailMarker.sent(NOW).isFreshReservation(NOW, GRACE)).isFalse();
        assertThat(EmailMarker.sent(NOW).isAbandonedReservation(NOW, GRACE)).isFalse();
    }
}
