package com.questrail.relay.transport;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Test-only {@link StreamConnector}: hands out a prepared connection, or fails.
 */
public final class FakeStreamConnector implements StreamConnector {

    private final FakeStreamConnection connection;
    private final Throwable failure;
    private final List<SocketAddress> attempted = new ArrayList<>();
    private boolean shutdown;

    private FakeStreamConnector(FakeStreamConnection connection, Throwable failure) {
        this.connection = connection;
        this.failure = failure;
    }

    public static FakeStreamConnector connectingTo(FakeStreamConnection connection) {
        return new FakeStreamConnector(connection, null);
    }

    public static FakeStreamConnector failingWith(Throwable failure) {
        return new FakeStreamConnector(null, failure);
    }

    @Override
    public CompletableFuture<StreamConnection> connect(List<? extends SocketAddress> candidates) {
        attempted.addAll(candidates);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(connection);
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    public List<SocketAddress> attempted() {
        return attempted;
    }

    public boolean isShutdown() {
        return shutdown;
    }
}
