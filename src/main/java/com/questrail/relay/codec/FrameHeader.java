package com.questrail.relay.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * FrameHeader
 * -----------------------------------------------------------------------------
 * Fixed 8-byte header of a client-to-server frame.
 *
 * <pre>
 *   offset 0..3 : command tag (ASCII)
 *   offset 4..7 : payload length, unsigned 32-bit, network byte order
 * </pre>
 *
 * <p>The length is the exact number of payload bytes that follow. A length of
 * zero means no payload read takes place.</p>
 *
 * @param tag           command tag
 * @param payloadLength payload byte count, {@code 0..0xFFFFFFFF}
 */
public record FrameHeader(CommandTag tag, long payloadLength)
{
    /** Header size in bytes. */
    public static final int SIZE = CommandTag.LENGTH + Integer.BYTES;

    /** Largest value the 32-bit unsigned length field can carry. */
    public static final long MAX_WIRE_LENGTH = 0xFFFF_FFFFL;

    public FrameHeader {
        Objects.requireNonNull(tag, "tag");
        if (payloadLength < 0 || payloadLength > MAX_WIRE_LENGTH) {
            throw new IllegalArgumentException("payloadLength out of range: " + payloadLength);
        }
    }

    /**
     * Decode a header from exactly {@link #SIZE} bytes.
     *
     * @throws FrameDecodeException if {@code bytes} is not exactly 8 bytes long
     */
    public static FrameHeader decode(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != SIZE) {
            throw new FrameDecodeException("Frame header must be " + SIZE + " bytes, got " + bytes.length);
        }

        CommandTag tag = CommandTag.fromBytes(bytes, 0);
        long length = Integer.toUnsignedLong(
                ByteBuffer.wrap(bytes, CommandTag.LENGTH, Integer.BYTES).order(ByteOrder.BIG_ENDIAN).getInt());
        return new FrameHeader(tag, length);
    }

    /**
     * Encode to 8 wire bytes.
     */
    public byte[] encode()
    {
        byte[] tagBytes = tag.toBytes();
        if (tagBytes.length != CommandTag.LENGTH) {
            throw new IllegalStateException("Tag \"" + tag + "\" encoded to " + tagBytes.length + " bytes");
        }
        return ByteBuffer.allocate(SIZE)
                .order(ByteOrder.BIG_ENDIAN)
                .put(tagBytes)
                .putInt((int) payloadLength)
                .array();
    }
}
