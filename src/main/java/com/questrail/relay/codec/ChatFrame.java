package com.questrail.relay.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ChatFrame
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one client-to-server message: a command
 * tag plus its payload.
 *
 * <p>The payload is raw bytes as received; {@link #payloadText()} interprets them
 * as UTF-8. The payload is copied on the way in and on the way out.</p>
 */
public final class ChatFrame
{
    private static final byte[] EMPTY = new byte[0];

    private final CommandTag tag;
    private final byte[] payload;

    public ChatFrame(CommandTag tag, byte[] payload)
    {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.payload = (payload == null || payload.length == 0) ? EMPTY : payload.clone();
    }

    public static ChatFrame of(CommandTag tag, String text)
    {
        Objects.requireNonNull(text, "text");
        return new ChatFrame(tag, text.getBytes(StandardCharsets.UTF_8));
    }

    public static ChatFrame chat(String text)
    {
        return of(CommandTag.CHAT, text);
    }

    public static ChatFrame rename(String name)
    {
        return of(CommandTag.NAME, name);
    }

    public static ChatFrame quit()
    {
        return new ChatFrame(CommandTag.QUIT, EMPTY);
    }

    public CommandTag tag()
    {
        return tag;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int payloadLength()
    {
        return payload.length;
    }

    public String payloadText()
    {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Returns the header describing this frame.
     */
    public FrameHeader header()
    {
        return new FrameHeader(tag, payload.length);
    }

    @Override
    public String toString()
    {
        return "ChatFrame[" +
                "tag=" + tag +
                ", payloadLength=" + payload.length +
                ']';
    }
}
