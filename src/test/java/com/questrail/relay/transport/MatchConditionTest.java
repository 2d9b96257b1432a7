package com.questrail.relay.transport;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MatchConditionTest
{
    private static final byte[] BUFFER = "ab\ncd\n".getBytes(StandardCharsets.US_ASCII);

    @Test
    void lineConditionMatchesJustPastFirstDelimiter()
    {
        MatchResult result = LineCondition.newline().evaluate(BUFFER, 0, BUFFER.length);

        assertTrue(result.matched());
        assertEquals(3, result.position());
    }

    @Test
    void lineConditionIgnoresBytesBeyondLength()
    {
        MatchResult result = LineCondition.newline().evaluate(BUFFER, 0, 2);

        assertFalse(result.matched());
    }

    @Test
    void lineConditionPositionIsRelativeToOffset()
    {
        MatchResult result = LineCondition.newline().evaluate(BUFFER, 3, 3);

        assertEquals(MatchResult.matchedAt(3), result);
    }

    @Test
    void lineConditionHonoursCustomDelimiter()
    {
        MatchResult result = new LineCondition((byte) 'c').evaluate(BUFFER, 0, BUFFER.length);

        assertEquals(MatchResult.matchedAt(4), result);
    }

    @Test
    void byteCountMatchesAtCountWhenEnoughBytes()
    {
        ByteCountCondition condition = new ByteCountCondition(4);

        assertFalse(condition.evaluate(BUFFER, 0, 3).matched());
        assertEquals(MatchResult.matchedAt(4), condition.evaluate(BUFFER, 0, 4));
        assertEquals(MatchResult.matchedAt(4), condition.evaluate(BUFFER, 0, 6));
    }

    @Test
    void zeroByteCountMatchesImmediately()
    {
        assertEquals(MatchResult.matchedAt(0), new ByteCountCondition(0).evaluate(new byte[0], 0, 0));
    }

    @Test
    void negativeByteCountIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new ByteCountCondition(-1));
    }
}
