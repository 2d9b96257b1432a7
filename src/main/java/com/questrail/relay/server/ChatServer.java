package com.questrail.relay.server;

import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.observability.NullObservabilitySink;
import com.questrail.relay.observability.RelayErrorEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.observability.RelayTransportEvent;
import com.questrail.relay.time.SystemWallClock;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.StreamAcceptor;
import com.questrail.relay.transport.StreamAcceptorListener;
import com.questrail.relay.transport.StreamConnection;
import com.questrail.relay.transport.netty.NettyStreamAcceptor;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * ChatServer
 * =============================================================================
 * Composition root and lifecycle owner for the relay server.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. It connects
 * a {@link StreamAcceptor} to the {@link ChatDispatcher} and reports listener
 * lifecycle to the observability sink. All command semantics live in the
 * dispatcher.
 *
 * <h2>Data Flow</h2>
 * <pre>
 *   StreamAcceptor
 *        → onAccepted(StreamConnection)
 *            → ChatDispatcher.accept
 *                → per-client message loop
 * </pre>
 *
 * <h2>Execution Model</h2>
 * The acceptor delivers every callback on its single event loop, which is also
 * the loop running every client connection. The dispatcher and registry are
 * therefore only ever touched by one thread.
 */
public final class ChatServer
{
    private final StreamAcceptor acceptor;
    private final ChatDispatcher dispatcher;
    private final RelayObservabilitySink observabilitySink;
    private final WallClock clock;

    private final CompletableFuture<SocketAddress> bound = new CompletableFuture<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    public ChatServer(RelayServerConfig config,
                      StreamAcceptor acceptor,
                      RelayObservabilitySink observabilitySink,
                      WallClock clock)
    {
        Objects.requireNonNull(config, "config");
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dispatcher = new ChatDispatcher(config, new ClientRegistry(), this.observabilitySink, clock);

        this.acceptor.setListener(new Listener());
    }

    /**
     * Production server: Netty acceptor bound to {@code config.bindAddress()}.
     */
    public static ChatServer create(RelayServerConfig config, RelayObservabilitySink observabilitySink)
    {
        return new ChatServer(
                config,
                new NettyStreamAcceptor(config.bindAddress()),
                observabilitySink,
                SystemWallClock.INSTANCE
        );
    }

    /**
     * Start listening.
     *
     * @return a future completing with the bound address, or exceptionally with
     *         the bind failure
     */
    public CompletableFuture<SocketAddress> start()
    {
        acceptor.start();
        return bound;
    }

    /**
     * Stop listening and close every client connection.
     */
    public void stop()
    {
        acceptor.stop();
    }

    /**
     * Completes once the listener has gone down (orderly stop or failure).
     */
    public CompletableFuture<Void> terminated()
    {
        return terminated;
    }

    ChatDispatcher dispatcher()
    {
        return dispatcher;
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    private final class Listener implements StreamAcceptorListener
    {
        @Override
        public void onTransportUp(SocketAddress localAddress)
        {
            observabilitySink.onTransportEvent(new RelayTransportEvent(
                    clock.now(), RelayTransportEvent.Type.UP, localAddress, null));
            bound.complete(localAddress);
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            observabilitySink.onTransportEvent(new RelayTransportEvent(
                    clock.now(), RelayTransportEvent.Type.DOWN, null, cause));
            if (cause != null) {
                bound.completeExceptionally(cause);
            }
            terminated.complete(null);
        }

        @Override
        public void onAccepted(StreamConnection connection)
        {
            dispatcher.accept(connection);
        }

        @Override
        public void onAcceptFailed(Throwable cause)
        {
            // Non-fatal: the acceptor keeps listening.
            observabilitySink.onError(new RelayErrorEvent(clock.now(), "Client error on accept", cause));
        }
    }
}
