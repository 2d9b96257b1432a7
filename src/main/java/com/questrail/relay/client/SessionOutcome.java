package com.questrail.relay.client;

import java.util.Objects;

/**
 * How a connected client session ended.
 *
 * @param kind  the ending
 * @param cause the failure for {@link Kind#READ_FAILURE} and {@link Kind#WRITE_FAILURE};
 *              {@code null} for {@link Kind#CLOSED}
 */
public record SessionOutcome(Kind kind, Throwable cause)
{
    public enum Kind {
        /** Local quit, end of console input, or explicit close. */
        CLOSED,
        /** The receive loop failed while the session was open (e.g. server went away). */
        READ_FAILURE,
        /** A send failed while the session was open. */
        WRITE_FAILURE
    }

    public SessionOutcome {
        Objects.requireNonNull(kind, "kind");
    }

    public static SessionOutcome closed() {
        return new SessionOutcome(Kind.CLOSED, null);
    }

    public static SessionOutcome readFailed(Throwable cause) {
        return new SessionOutcome(Kind.READ_FAILURE, cause);
    }

    public static SessionOutcome writeFailed(Throwable cause) {
        return new SessionOutcome(Kind.WRITE_FAILURE, cause);
    }

    public boolean isFailure() {
        return kind != Kind.CLOSED;
    }
}
