package com.questrail.relay.protocol;

import com.questrail.relay.codec.ChatFrame;
import com.questrail.relay.codec.FrameDecodeException;
import com.questrail.relay.codec.FrameHeader;
import com.questrail.relay.transport.ByteCountCondition;
import com.questrail.relay.transport.StreamConnection;

import java.util.Objects;

/**
 * FramedMessageReader
 * =============================================================================
 * Server-side reader for tag/length framed messages on one connection.
 *
 * <h2>State machine</h2>
 * <pre>
 *   AWAITING_HEADER  --8 bytes-->  length == 0 ? deliver(tag, empty)
 *                                               : AWAITING_PAYLOAD
 *   AWAITING_PAYLOAD --length bytes--> deliver(tag, payload)
 * </pre>
 *
 * <p>Each {@link #readMessage} call runs the machine once. The reader does not
 * re-arm itself: the caller issues the next {@code readMessage} after it has
 * finished handling the current frame, which keeps messages from one connection
 * strictly ordered.</p>
 *
 * <p>Any failure aborts the chain immediately and is reported once via
 * {@link FrameListener#onFailure}. A header announcing more than
 * {@code maxPayloadLength} bytes is such a failure.</p>
 */
public final class FramedMessageReader
{
    private final StreamConnection connection;
    private final int maxPayloadLength;

    public FramedMessageReader(StreamConnection connection, int maxPayloadLength)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        if (maxPayloadLength < 0) {
            throw new IllegalArgumentException("maxPayloadLength must be >= 0: " + maxPayloadLength);
        }
        this.maxPayloadLength = maxPayloadLength;
    }

    /**
     * Read one complete frame and report it to {@code listener}.
     */
    public void readMessage(FrameListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        connection.readUntil(
                new ByteCountCondition(FrameHeader.SIZE),
                (error, data) -> onHeader(error, data, listener)
        );
    }

    private void onHeader(Throwable error, byte[] data, FrameListener listener)
    {
        if (error != null) {
            listener.onFailure(error);
            return;
        }

        final FrameHeader header;
        try {
            header = FrameHeader.decode(data);
        }
        catch (FrameDecodeException e) {
            listener.onFailure(e);
            return;
        }

        if (header.payloadLength() > maxPayloadLength) {
            listener.onFailure(new FrameDecodeException(
                    "Payload length " + header.payloadLength() + " exceeds maximum " + maxPayloadLength
                            + " for command \"" + header.tag() + "\""));
            return;
        }

        if (header.payloadLength() == 0) {
            listener.onFrame(new ChatFrame(header.tag(), null));
            return;
        }

        connection.readUntil(
                new ByteCountCondition((int) header.payloadLength()),
                (payloadError, payload) -> onPayload(payloadError, payload, header, listener)
        );
    }

    private void onPayload(Throwable error, byte[] payload, FrameHeader header, FrameListener listener)
    {
        if (error != null) {
            listener.onFailure(error);
            return;
        }
        listener.onFrame(new ChatFrame(header.tag(), payload));
    }
}
