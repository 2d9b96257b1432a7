package com.questrail.relay.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link StreamAcceptor}.
 *
 * <p>All callbacks are delivered serialized, on the same execution context that
 * runs the accepted connections' callbacks.</p>
 */
public interface StreamAcceptorListener
{
    /**
     * The listening socket is bound.
     *
     * @param localAddress the bound address (useful when binding to port 0)
     */
    void onTransportUp(SocketAddress localAddress);

    /**
     * The listening socket failed to bind or was closed.
     *
     * @param cause the failure; {@code null} for an orderly stop
     */
    void onTransportDown(Throwable cause);

    /**
     * A connection was accepted. Bytes it receives are buffered until the first
     * read is issued.
     */
    void onAccepted(StreamConnection connection);

    /**
     * Accepting a single connection failed. The acceptor keeps listening.
     */
    void onAcceptFailed(Throwable cause);
}
