package com.questrail.relay.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onConnectionEvent(RelayConnectionEvent event) {
        switch (event.type()) {
            case CONNECTED -> log.info("Client connected from {}", event.remote());
            case QUIT -> log.info("Client {} ({}) quit", event.clientName(), event.remote());
            case DROPPED -> log.info("Client {} ({}) dropped: {}",
                event.clientName(),
                event.remote(),
                event.cause() != null ? event.cause().toString() : "unknown cause");
        }
    }

    @Override
    public void onProtocolEvent(RelayProtocolEvent event) {
        switch (event.type()) {
            case RENAMED -> log.debug("Client {} renamed to {}", event.detail(), event.clientName());
            case BROADCAST -> log.debug("Broadcast from {} to {} peer(s)", event.clientName(), event.detail());
            case UNKNOWN_COMMAND -> log.warn("Unknown command \"{}\" issued by {}", event.command(), event.clientName());
        }
    }

    @Override
    public void onTransportEvent(RelayTransportEvent event) {
        if (event.type() == RelayTransportEvent.Type.UP) {
            log.info("Relay listening on {}", event.address());
        }
        else if (event.cause() != null) {
            log.error("Relay listener down", event.cause());
        }
        else {
            log.info("Relay listener stopped");
        }
    }

    @Override
    public void onError(RelayErrorEvent event) {
        log.error("Relay error: {}", event.message(), event.cause());
    }
}
