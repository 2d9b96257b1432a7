package com.questrail.relay.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * CommandTag
 * -----------------------------------------------------------------------------
 * The 4-character ASCII command name that opens every client-to-server frame.
 *
 * <p>{@link #of(String)} normalizes arbitrary input: the first {@link #LENGTH}
 * characters are kept, anything outside ASCII becomes {@code '?'}, and shorter
 * names are right-padded with spaces. {@link #toBytes()} writes one byte per
 * character, so every tag occupies exactly {@link #LENGTH} bytes on the wire.</p>
 */
public record CommandTag(String value)
{
    /** Tag length in bytes. */
    public static final int LENGTH = 4;

    private static final int MAX_ASCII = 0x7F;
    private static final char REPLACEMENT = '?';

    public static final CommandTag NAME = new CommandTag("name");
    public static final CommandTag CHAT = new CommandTag("chat");
    public static final CommandTag QUIT = new CommandTag("quit");

    public CommandTag {
        Objects.requireNonNull(value, "value");
        if (value.length() != LENGTH) {
            throw new IllegalArgumentException("Command tag must be exactly " + LENGTH + " characters: \"" + value + "\"");
        }
    }

    /**
     * Pad or truncate {@code name} to a tag. Characters are counted by code point.
     */
    public static CommandTag of(String name)
    {
        Objects.requireNonNull(name, "name");
        StringBuilder sb = new StringBuilder(LENGTH);
        name.codePoints()
            .limit(LENGTH)
            .forEach(cp -> sb.append(cp <= MAX_ASCII ? (char) cp : REPLACEMENT));
        while (sb.length() < LENGTH) {
            sb.append(' ');
        }
        return new CommandTag(sb.toString());
    }

    /**
     * Decode a tag from 4 wire bytes (ASCII).
     */
    public static CommandTag fromBytes(byte[] bytes, int offset)
    {
        Objects.checkFromIndexSize(offset, LENGTH, bytes.length);
        return new CommandTag(new String(bytes, offset, LENGTH, StandardCharsets.US_ASCII));
    }

    /**
     * Encode as 4 ASCII bytes. Non-ASCII characters become {@code '?'}.
     */
    public byte[] toBytes()
    {
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            char c = value.charAt(i);
            bytes[i] = (byte) (c <= MAX_ASCII ? c : REPLACEMENT);
        }
        return bytes;
    }

    @Override
    public String toString()
    {
        return value;
    }
}
