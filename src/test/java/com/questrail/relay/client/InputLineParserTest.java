package com.questrail.relay.client;

import com.questrail.relay.codec.ChatFrame;
import com.questrail.relay.codec.ChatFrameEncoder;
import com.questrail.relay.codec.CommandTag;
import com.questrail.relay.codec.FrameHeader;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class InputLineParserTest
{
    private final InputLineParser parser = new InputLineParser('\\');

    private ChatFrame parse(String line)
    {
        return parser.parse(line).orElseThrow();
    }

    @Test
    void plainTextIsChat()
    {
        ChatFrame frame = parse("hello there");

        assertEquals(CommandTag.CHAT, frame.tag());
        assertEquals("hello there", frame.payloadText());
    }

    @Test
    void escapedNameCommandSkipsOneSeparatorSpace()
    {
        ChatFrame frame = parse("\\name alice");

        assertEquals(CommandTag.NAME, frame.tag());
        assertEquals("alice", frame.payloadText());
    }

    @Test
    void onlyOneSeparatorSpaceIsSkipped()
    {
        assertEquals(" alice", parse("\\name  alice").payloadText());
    }

    @Test
    void commandWithoutDataHasEmptyPayload()
    {
        ChatFrame frame = parse("\\quit");

        assertEquals(CommandTag.QUIT, frame.tag());
        assertEquals(0, frame.payloadLength());
    }

    @Test
    void shortCommandIsPadded()
    {
        ChatFrame frame = parse("\\me");

        assertEquals("me  ", frame.tag().value());
        assertEquals(0, frame.payloadLength());
    }

    @Test
    void commandIsAlwaysTheNextFourCharacters()
    {
        ChatFrame frame = parse("\\chatty talk");

        assertEquals(CommandTag.CHAT, frame.tag());
        assertEquals("ty talk", frame.payloadText());
    }

    @Test
    void shortCommandEndsAtSpace()
    {
        ChatFrame frame = parse("\\me hi");

        assertEquals("me  ", frame.tag().value());
        assertEquals("hi", frame.payloadText());
    }

    @Test
    void nonAsciiCommandStillEncodesFourTagBytes()
    {
        ChatFrame frame = parse("\\\uD83D\uDE00ab x");

        assertEquals("?ab ", frame.tag().value());
        assertEquals("x", frame.payloadText());

        FrameHeader header = FrameHeader.decode(
                Arrays.copyOf(new ChatFrameEncoder().encode(frame), FrameHeader.SIZE));
        assertEquals(1, header.payloadLength());
    }

    @Test
    void emptyLineProducesNothing()
    {
        assertTrue(parser.parse("").isEmpty());
    }

    @Test
    void escapeCharacterIsConfigurable()
    {
        InputLineParser slash = new InputLineParser('/');

        assertEquals(CommandTag.NAME, slash.parse("/name bob").orElseThrow().tag());
        assertEquals(CommandTag.CHAT, slash.parse("\\name bob").orElseThrow().tag());
    }
}
