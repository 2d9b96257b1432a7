package com.questrail.relay.observability;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a change in the listening socket's state.
 *
 * @param address the bound address for {@link Type#UP}; otherwise may be {@code null}
 * @param cause   the failure for a {@link Type#DOWN} caused by an error; otherwise {@code null}
 */
public record RelayTransportEvent(
    Instant timestamp,
    Type type,
    SocketAddress address,
    Throwable cause
) {
    public enum Type {
        UP,
        DOWN
    }

    public RelayTransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
    }
}
