package com.questrail.relay.transport;

/**
 * Outcome of evaluating a {@link MatchCondition} against the bytes accumulated
 * so far.
 *
 * @param position when {@code matched}, the number of leading bytes that make up
 *                 the match (the read consumes exactly these bytes); otherwise the
 *                 number of bytes inspected
 * @param matched  whether enough bytes have arrived to satisfy the read
 */
public record MatchResult(int position, boolean matched)
{
    public MatchResult {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0: " + position);
        }
    }

    public static MatchResult matchedAt(int position) {
        return new MatchResult(position, true);
    }

    public static MatchResult notMatched(int inspected) {
        return new MatchResult(inspected, false);
    }
}
