package com.questrail.relay.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements RelayObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onConnectionEvent(RelayConnectionEvent event) {
        events.add(event);
        notifyAll();
    }

    @Override
    public synchronized void onProtocolEvent(RelayProtocolEvent event) {
        events.add(event);
        notifyAll();
    }

    @Override
    public synchronized void onTransportEvent(RelayTransportEvent event) {
        events.add(event);
        notifyAll();
    }

    @Override
    public synchronized void onError(RelayErrorEvent event) {
        events.add(event);
        notifyAll();
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<RelayConnectionEvent> getConnectionEvents() {
        return ofType(RelayConnectionEvent.class);
    }

    public synchronized List<RelayProtocolEvent> getProtocolEvents() {
        return ofType(RelayProtocolEvent.class);
    }

    public synchronized long countConnectionEvents(RelayConnectionEvent.Type type) {
        return getConnectionEvents().stream().filter(e -> e.type() == type).count();
    }

    public synchronized long countProtocolEvents(RelayProtocolEvent.Type type) {
        return getProtocolEvents().stream().filter(e -> e.type() == type).count();
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    /**
     * Block until at least {@code count} connection events of {@code type} were seen.
     *
     * @return {@code false} on timeout
     */
    public synchronized boolean awaitConnectionEvents(RelayConnectionEvent.Type type, int count, long timeoutMillis)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (countConnectionEvents(type) < count) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
