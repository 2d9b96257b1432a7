package com.questrail.relay.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatFrameEncoderTest
{
    private final ChatFrameEncoder encoder = new ChatFrameEncoder();

    @Test
    void encodesHeaderFollowedByPayload()
    {
        byte[] encoded = encoder.encode(ChatFrame.rename("alice"));

        assertArrayEquals(
                new byte[] { 'n', 'a', 'm', 'e', 0, 0, 0, 5, 'a', 'l', 'i', 'c', 'e' },
                encoded);
    }

    @Test
    void quitHasHeaderOnly()
    {
        assertArrayEquals(new byte[] { 'q', 'u', 'i', 't', 0, 0, 0, 0 }, encoder.encode(ChatFrame.quit()));
    }

    @Test
    void lengthCountsUtf8Bytes()
    {
        byte[] encoded = encoder.encode(ChatFrame.chat("hé"));

        assertEquals(FrameHeader.SIZE + 3, encoded.length);
        assertEquals(3, encoded[7]);
    }

    @Test
    void bufferMatchesByteEncoding()
    {
        ChatFrame frame = ChatFrame.chat("hello");

        assertArrayEquals(encoder.encode(frame), encoder.encodeToBuffer(frame).toByteArray());
    }
}
