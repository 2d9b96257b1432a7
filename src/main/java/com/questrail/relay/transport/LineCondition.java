package com.questrail.relay.transport;

/**
 * Matches once a delimiter byte has been received. The match position is just
 * past the first delimiter, so the delimiter is part of the delivered bytes.
 */
public final class LineCondition implements MatchCondition
{
    /** Newline, the delimiter used for server broadcasts. */
    public static final byte NEWLINE = '\n';

    private final byte delimiter;

    public LineCondition(byte delimiter)
    {
        this.delimiter = delimiter;
    }

    public static LineCondition newline()
    {
        return new LineCondition(NEWLINE);
    }

    public byte delimiter()
    {
        return delimiter;
    }

    @Override
    public MatchResult evaluate(byte[] buffer, int offset, int length)
    {
        for (int i = 0; i < length; i++) {
            if (buffer[offset + i] == delimiter) {
                return MatchResult.matchedAt(i + 1);
            }
        }
        return MatchResult.notMatched(length);
    }

    @Override
    public String toString()
    {
        return "LineCondition[delimiter=0x" + Integer.toHexString(delimiter & 0xFF) + ']';
    }
}
