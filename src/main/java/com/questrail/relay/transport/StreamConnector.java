package com.questrail.relay.transport;

import java.net.SocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * StreamConnector
 * -----------------------------------------------------------------------------
 * Port for opening outbound stream connections.
 *
 * <p>The connector owns the execution context that runs the connections it
 * creates. {@link #shutdown()} releases it.</p>
 */
public interface StreamConnector
{
    /**
     * Try {@code candidates} in order until one connects.
     *
     * @param candidates resolved endpoints for one host; must not be empty
     * @return a future completing with the first successful connection, or
     *         exceptionally with the last connect failure
     */
    CompletableFuture<StreamConnection> connect(List<? extends SocketAddress> candidates);

    /**
     * Release the execution context. Open connections are closed.
     */
    void shutdown();
}
