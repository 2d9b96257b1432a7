package com.questrail.relay.observability;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a client joining or leaving the relay.
 *
 * @param clientName the client's display name at the time of the event
 * @param remote     the client's remote address; may be {@code null}
 * @param cause      for {@link Type#DROPPED}, the read/write failure; otherwise {@code null}
 */
public record RelayConnectionEvent(
    Instant timestamp,
    Type type,
    String clientName,
    SocketAddress remote,
    Throwable cause
) {
    public enum Type {
        /** Accepted and added to the registry. */
        CONNECTED,
        /** Left via an explicit {@code quit}. */
        QUIT,
        /** Removed after a read or write failure (including EOF). */
        DROPPED
    }

    public RelayConnectionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(clientName, "clientName");
    }
}
