package com.questrail.relay.protocol;

import com.questrail.relay.transport.LineCondition;
import com.questrail.relay.transport.StreamConnection;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * LineMessageReader
 * =============================================================================
 * Client-side receive loop for server broadcasts: newline-terminated UTF-8 text.
 *
 * <p>Single state. Read up to {@code '\n'}, strip the terminator (and a
 * preceding {@code '\r'}), hand the text to the listener, then re-arm. The loop
 * runs until the connection reports an error.</p>
 */
public final class LineMessageReader
{
    private final StreamConnection connection;
    private final LineCondition condition = LineCondition.newline();

    public LineMessageReader(StreamConnection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    /**
     * Start the receive loop.
     */
    public void start(LineListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        readNext(listener);
    }

    private void readNext(LineListener listener)
    {
        connection.readUntil(condition, (error, data) -> {
            if (error != null) {
                listener.onFailure(error);
                return;
            }
            listener.onLine(stripTerminator(data));
            readNext(listener);
        });
    }

    static String stripTerminator(byte[] data)
    {
        int end = data.length;
        if (end > 0 && data[end - 1] == LineCondition.NEWLINE) {
            end--;
        }
        if (end > 0 && data[end - 1] == '\r') {
            end--;
        }
        return new String(data, 0, end, StandardCharsets.UTF_8);
    }
}
