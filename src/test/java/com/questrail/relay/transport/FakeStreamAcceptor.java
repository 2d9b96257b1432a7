package com.questrail.relay.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * Test-only {@link StreamAcceptor}. Tests drive accepts and failures directly.
 */
public final class FakeStreamAcceptor implements StreamAcceptor {

    private final SocketAddress localAddress;
    private StreamAcceptorListener listener;
    private Throwable bindFailure;
    private boolean started;
    private boolean bound;

    public FakeStreamAcceptor() {
        this(new InetSocketAddress("127.0.0.1", 8888));
    }

    public FakeStreamAcceptor(SocketAddress localAddress) {
        this.localAddress = localAddress;
    }

    @Override
    public void setListener(StreamAcceptorListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        if (bindFailure != null) {
            listener.onTransportDown(bindFailure);
            return;
        }
        bound = true;
        listener.onTransportUp(localAddress);
    }

    @Override
    public void stop() {
        started = false;
        if (bound) {
            bound = false;
            listener.onTransportDown(null);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failBindWith(Throwable cause) {
        this.bindFailure = cause;
    }

    public void accept(StreamConnection connection) {
        requireListener().onAccepted(connection);
    }

    public void failAccept(Throwable cause) {
        requireListener().onAcceptFailed(cause);
    }

    public boolean isStarted() {
        return started;
    }

    private StreamAcceptorListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
