package com.questrail.relay.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the relay that does not map to a
 * single client leaving (e.g. an accept failure).
 */
public record RelayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
