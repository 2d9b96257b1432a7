package com.questrail.relay.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a command handled by the dispatcher.
 *
 * @param clientName the issuing client's display name (after a rename, the new name)
 * @param command    the 4-character command tag as received
 * @param detail     type-specific detail: the previous name for {@link Type#RENAMED},
 *                   the recipient count for {@link Type#BROADCAST}, empty otherwise
 */
public record RelayProtocolEvent(
    Instant timestamp,
    Type type,
    String clientName,
    String command,
    String detail
) {
    public enum Type {
        RENAMED,
        BROADCAST,
        UNKNOWN_COMMAND
    }

    public RelayProtocolEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(clientName, "clientName");
        Objects.requireNonNull(command, "command");
        detail = (detail == null) ? "" : detail;
    }
}
