package com.sitecheck.common.model;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.UUID;

/**
 * Parsed form of the {@code email_marker} column of an audit.
 *
 * <p>The column holds one of:
 * <ul>
 *   <li>{@code null}: no email has been attempted;</li>
 *   <li>{@code sending:<instant>:<token>}: a reservation written by the invocation
 *       identified by {@code token} right before it started sending;</li>
 *   <li>{@code <instant>}: the time the email was confirmed sent.</li>
 * </ul>
 * Reservations are compared by their exact raw value, so commit and release can be
 * expressed as compare-and-swap updates on the column.
 */
public final class EmailMarker {

    public static final String RESERVATION_PREFIX = "sending:";

    public enum State { NONE, RESERVED, SENT }

    private static final EmailMarker NONE = new EmailMarker(State.NONE, null, null, null);

    private final State state;
    private final Instant timestamp;
    private final String token;
    private final String raw;

    private EmailMarker(State state, Instant timestamp, String token, String raw) {
        this.state = state;
        this.timestamp = timestamp;
        this.token = token;
        this.raw = raw;
    }

    public static EmailMarker none() {
        return NONE;
    }

    public static EmailMarker reservation(Instant reservedAt) {
        return reservation(reservedAt, UUID.randomUUID().toString().substring(0, 8));
    }

    public static EmailMarker reservation(Instant reservedAt, String token) {
        Objects.requireNonNull(reservedAt, "reservedAt");
        Objects.requireNonNull(token, "token");
        return new EmailMarker(State.RESERVED, reservedAt, token,
            RESERVATION_PREFIX + reservedAt + ":" + token);
    }

    public static EmailMarker sent(Instant sentAt) {
        Objects.requireNonNull(sentAt, "sentAt");
        return new EmailMarker(State.SENT, sentAt, null, sentAt.toString());
    }

    /**
     * Parse a raw column value. Unreadable values are treated as committed sends so a
     * malformed marker can never cause a second email; they carry no timestamp.
     */
    public static EmailMarker parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        if (raw.startsWith(RESERVATION_PREFIX)) {
            String body = raw.substring(RESERVATION_PREFIX.length());
            int separator = body.lastIndexOf(':');
            Instant reservedAt = separator > 0 ? parseInstant(body.substring(0, separator)) : null;
            if (reservedAt == null) {
                // unreadable age: treat as long abandoned
                return new EmailMarker(State.RESERVED, Instant.EPOCH, "", raw);
            }
            return new EmailMarker(State.RESERVED, reservedAt, body.substring(separator + 1), raw);
        }
        return new EmailMarker(State.SENT, parseInstant(raw), null, raw);
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public State getState() {
        return state;
    }

    public boolean isNone() {
        return state == State.NONE;
    }

    public boolean isReserved() {
        return state == State.RESERVED;
    }

    public boolean isSent() {
        return state == State.SENT;
    }

    /**
     * Reservation time for {@link State#RESERVED}, send time for {@link State#SENT}.
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public String getToken() {
        return token;
    }

    /**
     * Value as stored in the column, {@code null} for {@link State#NONE}.
     */
    public String getRaw() {
        return raw;
    }

    /**
     * A reservation younger than the grace window belongs to an invocation that may
     * still be sending.
     */
    public boolean isFreshReservation(Instant now, Duration graceWindow) {
        return isReserved() && timestamp.plus(graceWindow).isAfter(now);
    }

    public boolean isAbandonedReservation(Instant now, Duration graceWindow) {
        return isReserved() && !isFreshReservation(now, graceWindow);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmailMarker)) return false;
        EmailMarker other = (EmailMarker) o;
        return state == other.state && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, raw);
    }

    @Override
    public String toString() {
        return state == State.NONE ? "none" : raw;
    }
}
