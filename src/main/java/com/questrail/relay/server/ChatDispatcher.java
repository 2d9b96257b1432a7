package com.questrail.relay.server;

import com.questrail.relay.codec.ChatFrame;
import com.questrail.relay.codec.CommandTag;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.observability.NullObservabilitySink;
import com.questrail.relay.observability.RelayConnectionEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.observability.RelayProtocolEvent;
import com.questrail.relay.protocol.FrameListener;
import com.questrail.relay.protocol.FramedMessageReader;
import com.questrail.relay.time.SystemWallClock;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.StreamConnection;
import com.questrail.relay.transport.WriteBuffer;

import java.util.List;
import java.util.Objects;

/**
 * ChatDispatcher
 * =============================================================================
 * Owns the client registry and runs every client's message loop.
 *
 * <h2>Per-client loop</h2>
 * <pre>
 *   accept → register → readMessage
 *                          ├─ failure → close, unregister, stop
 *                          └─ frame   → dispatch
 *                                         ├─ name  → rename
 *                                         ├─ chat  → broadcast to peers
 *                                         ├─ quit  → close, unregister, stop
 *                                         └─ other → report unknown command
 *                                       → readMessage (re-arm)
 * </pre>
 *
 * <p>The next read is armed only after the current frame has been dispatched, so
 * frames from one client are handled strictly in arrival order. No ordering is
 * implied across clients.</p>
 *
 * <h2>Broadcast</h2>
 * A chat frame becomes one {@code "<name>: <text>\n"} {@link WriteBuffer}, shared by
 * the writes to every other registered client. A failed write is a terminal error
 * for that recipient.
 *
 * <h2>Execution Model</h2>
 * All calls must be serialized on one execution context (the server's event loop).
 * Nothing here blocks.
 */
public final class ChatDispatcher
{
    private final RelayServerConfig config;
    private final ClientRegistry registry;
    private final RelayObservabilitySink observabilitySink;
    private final WallClock clock;

    public ChatDispatcher(RelayServerConfig config,
                          ClientRegistry registry,
                          RelayObservabilitySink observabilitySink,
                          WallClock clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ChatDispatcher(RelayServerConfig config, ClientRegistry registry)
    {
        this(config, registry, null, SystemWallClock.INSTANCE);
    }

    /**
     * Register a newly accepted connection under the default name and start its
     * message loop.
     */
    public ClientRecord accept(StreamConnection connection)
    {
        Objects.requireNonNull(connection, "connection");

        ClientRecord client = new ClientRecord(
                connection,
                new FramedMessageReader(connection, config.maxPayloadLength()),
                config.defaultName()
        );
        registry.add(client);

        observabilitySink.onConnectionEvent(new RelayConnectionEvent(
                clock.now(),
                RelayConnectionEvent.Type.CONNECTED,
                client.name(),
                connection.remoteAddress(),
                null
        ));

        readNext(client);
        return client;
    }

    public ClientRegistry registry()
    {
        return registry;
    }

    private void readNext(ClientRecord client)
    {
        client.reader().readMessage(new FrameListener() {
            @Override
            public void onFrame(ChatFrame frame)
            {
                // Frames buffered before a drop may still surface; the client is gone.
                if (!registry.contains(client)) {
                    return;
                }
                dispatch(client, frame);
            }

            @Override
            public void onFailure(Throwable cause)
            {
                drop(client, cause);
            }
        });
    }

    private void dispatch(ClientRecord client, ChatFrame frame)
    {
        final CommandTag tag = frame.tag();

        if (CommandTag.NAME.equals(tag)) {
            handleRename(client, frame);
        }
        else if (CommandTag.CHAT.equals(tag)) {
            handleChat(client, frame);
        }
        else if (CommandTag.QUIT.equals(tag)) {
            handleQuit(client);
            return;
        }
        else {
            handleUnknown(client, tag);
        }

        // Re-arm: this is what keeps the client's loop alive.
        readNext(client);
    }

    private void handleRename(ClientRecord client, ChatFrame frame)
    {
        String previous = client.name();
        client.rename(frame.payloadText());

        observabilitySink.onProtocolEvent(new RelayProtocolEvent(
                clock.now(),
                RelayProtocolEvent.Type.RENAMED,
                client.name(),
                frame.tag().value(),
                previous
        ));
    }

    private void handleChat(ClientRecord client, ChatFrame frame)
    {
        // One buffer for every recipient.
        final WriteBuffer message = WriteBuffer.utf8(client.name() + ": " + frame.payloadText() + "\n");

        final List<ClientRecord> peers = registry.peersOf(client);
        for (ClientRecord peer : peers) {
            peer.connection().write(message, (error, bytesWritten) -> {
                if (error != null) {
                    drop(peer, error);
                }
            });
        }

        observabilitySink.onProtocolEvent(new RelayProtocolEvent(
                clock.now(),
                RelayProtocolEvent.Type.BROADCAST,
                client.name(),
                frame.tag().value(),
                Integer.toString(peers.size())
        ));
    }

    private void handleQuit(ClientRecord client)
    {
        boolean removed = registry.remove(client);
        client.connection().close();

        if (removed) {
            observabilitySink.onConnectionEvent(new RelayConnectionEvent(
                    clock.now(),
                    RelayConnectionEvent.Type.QUIT,
                    client.name(),
                    client.connection().remoteAddress(),
                    null
            ));
        }
    }

    private void handleUnknown(ClientRecord client, CommandTag tag)
    {
        observabilitySink.onProtocolEvent(new RelayProtocolEvent(
                clock.now(),
                RelayProtocolEvent.Type.UNKNOWN_COMMAND,
                client.name(),
                tag.value(),
                null
        ));
    }

    /**
     * Terminal read/write failure. Idempotent: only the first report unregisters
     * and is observed.
     */
    private void drop(ClientRecord client, Throwable cause)
    {
        boolean removed = registry.remove(client);
        client.connection().close();

        if (removed) {
            observabilitySink.onConnectionEvent(new RelayConnectionEvent(
                    clock.now(),
                    RelayConnectionEvent.Type.DROPPED,
                    client.name(),
                    client.connection().remoteAddress(),
                    cause
            ));
        }
    }
}
