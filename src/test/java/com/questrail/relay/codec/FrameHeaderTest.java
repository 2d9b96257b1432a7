package com.questrail.relay.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FrameHeaderTest
{
    @Test
    void decodesTagAndBigEndianLength()
    {
        byte[] bytes = { 'c', 'h', 'a', 't', 0x00, 0x00, 0x01, 0x02 };

        FrameHeader header = FrameHeader.decode(bytes);

        assertEquals(CommandTag.CHAT, header.tag());
        assertEquals(258, header.payloadLength());
    }

    @Test
    void lengthIsUnsigned()
    {
        byte[] bytes = { 'c', 'h', 'a', 't', (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        assertEquals(FrameHeader.MAX_WIRE_LENGTH, FrameHeader.decode(bytes).payloadLength());
    }

    @Test
    void rejectsWrongSize()
    {
        assertThrows(FrameDecodeException.class, () -> FrameHeader.decode(new byte[7]));
        assertThrows(FrameDecodeException.class, () -> FrameHeader.decode(new byte[9]));
    }

    @Test
    void encodesNameFrameHeader()
    {
        byte[] encoded = new FrameHeader(CommandTag.NAME, 5).encode();

        assertArrayEquals(new byte[] { 'n', 'a', 'm', 'e', 0, 0, 0, 5 }, encoded);
    }

    @Test
    void unknownTagsDecodeVerbatim()
    {
        byte[] bytes = "xyz!\0\0\0\0".getBytes(StandardCharsets.US_ASCII);

        FrameHeader header = FrameHeader.decode(bytes);

        assertEquals("xyz!", header.tag().value());
        assertEquals(0, header.payloadLength());
    }
}
