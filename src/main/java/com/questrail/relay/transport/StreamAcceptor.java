package com.questrail.relay.transport;

/**
 * StreamAcceptor
 * -----------------------------------------------------------------------------
 * Minimal port for a listening stream socket.
 *
 * <p>The acceptor keeps accepting for its whole lifetime: a new connection is
 * accepted while the previous one is still being set up, and an accept failure
 * is reported without stopping the listener.</p>
 *
 * <p>Higher layers are responsible for everything that happens on an accepted
 * connection (framing, registry, dispatch).</p>
 */
public interface StreamAcceptor
{
    /**
     * Bind and begin accepting.
     *
     * <p>On success the listener receives {@link StreamAcceptorListener#onTransportUp}
     * once; on bind failure it receives {@link StreamAcceptorListener#onTransportDown}
     * with the cause.</p>
     */
    void start();

    /**
     * Stop accepting and release the listening socket and its execution context.
     */
    void stop();

    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(StreamAcceptorListener listener);
}
