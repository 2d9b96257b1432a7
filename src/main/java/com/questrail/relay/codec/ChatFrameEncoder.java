package com.questrail.relay.codec;

import com.questrail.relay.transport.WriteBuffer;

import java.util.Objects;

/**
 * ChatFrameEncoder
 * -----------------------------------------------------------------------------
 * Encodes a {@link ChatFrame} as header followed by payload, ready for a single
 * write.
 *
 * <pre>
 *   [ tag (4) ][ length (4, big-endian) ][ payload (length) ]
 * </pre>
 *
 * <p>Decoding is not symmetric: the server reads header and payload as two
 * separate socket reads (see {@code FramedMessageReader}).</p>
 */
public final class ChatFrameEncoder
{
    public byte[] encode(ChatFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final byte[] header = frame.header().encode();
        final byte[] payload = frame.payload();

        byte[] out = new byte[header.length + payload.length];
        System.arraycopy(header, 0, out, 0, header.length);
        System.arraycopy(payload, 0, out, header.length, payload.length);
        return out;
    }

    public WriteBuffer encodeToBuffer(ChatFrame frame)
    {
        return WriteBuffer.copyOf(encode(frame));
    }
}
