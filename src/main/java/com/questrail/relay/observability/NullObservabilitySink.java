package com.questrail.relay.observability;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(RelayConnectionEvent event) {}

    @Override
    public void onProtocolEvent(RelayProtocolEvent event) {}

    @Override
    public void onTransportEvent(RelayTransportEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
