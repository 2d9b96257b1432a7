package com.questrail.relay.client;

import com.questrail.relay.codec.ChatFrame;
import com.questrail.relay.codec.ChatFrameEncoder;
import com.questrail.relay.codec.CommandTag;
import com.questrail.relay.config.RelayClientConfig;
import com.questrail.relay.protocol.LineListener;
import com.questrail.relay.protocol.LineMessageReader;
import com.questrail.relay.transport.StreamConnection;
import com.questrail.relay.transport.StreamConnector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * ChatClient
 * =============================================================================
 * One client session against a relay server.
 *
 * <h2>Threading</h2>
 * The receive loop runs on the connector's event loop. {@link #send(ChatFrame)}
 * and {@link #submitLine(String)} are called from the console thread; the
 * underlying {@link StreamConnection} hands those writes to its event loop, so
 * the socket is only ever touched from one thread.
 *
 * <h2>Ending</h2>
 * {@link #finished()} completes exactly once:
 * <ul>
 *   <li>{@code CLOSED} after a quit frame has been flushed, or after {@link #close()}</li>
 *   <li>{@code READ_FAILURE} when the receive loop fails while the session is open</li>
 *   <li>{@code WRITE_FAILURE} when a send fails while the session is open</li>
 * </ul>
 */
public final class ChatClient
{
    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    private final RelayClientConfig config;
    private final StreamConnector connector;
    private final HostResolver resolver;
    private final Consumer<String> display;

    private final InputLineParser parser;
    private final ChatFrameEncoder encoder = new ChatFrameEncoder();
    private final CompletableFuture<SessionOutcome> finished = new CompletableFuture<>();

    private volatile StreamConnection connection;
    private volatile boolean closing;

    public ChatClient(RelayClientConfig config,
                      StreamConnector connector,
                      HostResolver resolver,
                      Consumer<String> display)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.display = Objects.requireNonNull(display, "display");
        this.parser = new InputLineParser(config.escapeCharacter());
    }

    /**
     * Resolve the server, connect to the first reachable candidate and start
     * receiving broadcasts.
     *
     * <p>The returned future fails with {@link ResolutionException} when the host
     * cannot be resolved, or with the last connect failure when no candidate
     * accepts.</p>
     */
    public CompletableFuture<Void> connect()
    {
        final List<InetSocketAddress> candidates;
        try {
            candidates = resolver.resolve(config.host(), config.port());
        }
        catch (ResolutionException e) {
            return CompletableFuture.failedFuture(e);
        }

        return connector.connect(candidates).thenAccept(c -> {
            connection = c;
            log.info("Connected to {}", c.remoteAddress());
            new LineMessageReader(c).start(new Receiver());
        });
    }

    /**
     * Parse one console line and send the resulting frame, if any.
     *
     * @return {@code false} once the line was a quit command
     */
    public boolean submitLine(String line)
    {
        Optional<ChatFrame> frame = parser.parse(line);
        if (frame.isEmpty()) {
            return true;
        }
        send(frame.get());
        return !CommandTag.QUIT.equals(frame.get().tag());
    }

    /**
     * Fire-and-forget send. A quit frame closes the session once it is flushed.
     */
    public void send(ChatFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        final StreamConnection c = requireConnection();
        final boolean quitting = CommandTag.QUIT.equals(frame.tag());
        if (quitting) {
            closing = true;
        }

        c.write(encoder.encodeToBuffer(frame), (error, bytesWritten) -> {
            if (quitting) {
                c.close();
                finish(SessionOutcome.closed());
                return;
            }
            if (error != null && !closing) {
                log.error("Write error", error);
                closing = true;
                finish(SessionOutcome.writeFailed(error));
                c.close();
            }
        });
    }

    /**
     * Send a quit frame and close once it is on the wire.
     */
    public void quit()
    {
        send(ChatFrame.quit());
    }

    /**
     * Close without notifying the server.
     */
    public void close()
    {
        closing = true;
        StreamConnection c = connection;
        if (c != null) {
            c.close();
        }
        finish(SessionOutcome.closed());
    }

    public CompletableFuture<SessionOutcome> finished()
    {
        return finished;
    }

    public boolean isFinished()
    {
        return finished.isDone();
    }

    private StreamConnection requireConnection()
    {
        StreamConnection c = connection;
        if (c == null) {
            throw new IllegalStateException("not connected");
        }
        return c;
    }

    private void finish(SessionOutcome outcome)
    {
        if (finished.complete(outcome)) {
            log.info("Session ended: {}", outcome.kind());
        }
    }

    private final class Receiver implements LineListener
    {
        @Override
        public void onLine(String line)
        {
            display.accept(line);
        }

        @Override
        public void onFailure(Throwable cause)
        {
            if (closing) {
                finish(SessionOutcome.closed());
                return;
            }
            log.error("Read error", cause);
            closing = true;
            finish(SessionOutcome.readFailed(cause));
            connection.close();
        }
    }
}
