package com.questrail.relay.transport;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * WriteBuffer
 * -----------------------------------------------------------------------------
 * Immutable outbound byte buffer.
 *
 * <p>The bytes are copied once at construction and never modified afterwards,
 * so a single instance may be handed to any number of concurrent writes (one
 * broadcast buffer serves every recipient). Each pending write holds a reference
 * until its completion runs; the buffer is reclaimed once none remain.</p>
 */
public final class WriteBuffer
{
    private final byte[] bytes;

    private WriteBuffer(byte[] bytes)
    {
        this.bytes = bytes;
    }

    public static WriteBuffer copyOf(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        return new WriteBuffer(bytes.clone());
    }

    public static WriteBuffer utf8(String text)
    {
        Objects.requireNonNull(text, "text");
        return new WriteBuffer(text.getBytes(StandardCharsets.UTF_8));
    }

    public int length()
    {
        return bytes.length;
    }

    /**
     * Returns a read-only view over the shared bytes. Each call returns an
     * independent position/limit, so views may be consumed concurrently.
     */
    public ByteBuffer asReadOnlyBuffer()
    {
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }

    /**
     * Returns a copy of the contents.
     */
    public byte[] toByteArray()
    {
        return bytes.clone();
    }

    public String toUtf8String()
    {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public String toString()
    {
        return "WriteBuffer[length=" + bytes.length + ']';
    }
}
