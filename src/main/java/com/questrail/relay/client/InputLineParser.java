package com.questrail.relay.client;

import com.questrail.relay.codec.ChatFrame;
import com.questrail.relay.codec.CommandTag;

import java.util.Objects;
import java.util.Optional;

/**
 * InputLineParser
 * -----------------------------------------------------------------------------
 * Translates one console line into the frame to send.
 *
 * <pre>
 *   &lt;esc&gt;&lt;cmd&gt;[ ]&lt;data&gt;   →  tag = cmd padded/truncated to 4, payload = data
 *   anything else         →  tag = "chat", payload = whole line
 *   empty line            →  nothing
 * </pre>
 *
 * <p>The command is the (up to) four characters following the escape character,
 * ending early at a space, so {@code \me hi} is command {@code "me"} with payload
 * {@code "hi"}. A single space after the command is a separator and is not part of
 * the payload.</p>
 */
public final class InputLineParser
{
    private final char escapeCharacter;

    public InputLineParser(char escapeCharacter)
    {
        this.escapeCharacter = escapeCharacter;
    }

    public Optional<ChatFrame> parse(String line)
    {
        Objects.requireNonNull(line, "line");

        if (line.isEmpty()) {
            return Optional.empty();
        }

        if (line.charAt(0) != escapeCharacter) {
            return Optional.of(ChatFrame.chat(line));
        }

        final int tagEnd = commandEnd(line);
        final CommandTag tag = CommandTag.of(line.substring(1, tagEnd));

        String payload = line.substring(tagEnd);
        if (payload.startsWith(" ")) {
            payload = payload.substring(1);
        }
        return Optional.of(ChatFrame.of(tag, payload));
    }

    /**
     * Index just past the command: at most {@link CommandTag#LENGTH} code points
     * after the escape, stopping before the first space.
     */
    private static int commandEnd(String line)
    {
        int index = 1;
        for (int taken = 0; taken < CommandTag.LENGTH && index < line.length(); taken++) {
            int cp = line.codePointAt(index);
            if (cp == ' ') {
                break;
            }
            index += Character.charCount(cp);
        }
        return index;
    }
}
