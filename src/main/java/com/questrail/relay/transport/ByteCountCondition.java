package com.questrail.relay.transport;

/**
 * Matches once at least {@code count} bytes have accumulated. The match position
 * is always {@code count}; anything beyond it stays buffered for the next read.
 */
public final class ByteCountCondition implements MatchCondition
{
    private final int count;

    public ByteCountCondition(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        this.count = count;
    }

    public int count()
    {
        return count;
    }

    @Override
    public MatchResult evaluate(byte[] buffer, int offset, int length)
    {
        if (length >= count) {
            return MatchResult.matchedAt(count);
        }
        return MatchResult.notMatched(length);
    }

    @Override
    public String toString()
    {
        return "ByteCountCondition[count=" + count + ']';
    }
}
