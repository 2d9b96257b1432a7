package com.questrail.relay.observability;

/**
 * Main interface for receiving relay observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>On the server all callbacks arrive on the event loop thread; implementations
 * must not block.</p>
 */
public interface RelayObservabilitySink {
    /**
     * Called when a client is added to or removed from the registry.
     * @param event the connection event
     */
    void onConnectionEvent(RelayConnectionEvent event);

    /**
     * Called when the dispatcher handles a command (rename, broadcast, unknown).
     * @param event the protocol event
     */
    void onProtocolEvent(RelayProtocolEvent event);

    /**
     * Called when the listening socket comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(RelayTransportEvent event);

    /**
     * Called when an error occurs that is not tied to a single client.
     * @param event the error event
     */
    void onError(RelayErrorEvent event);
}
