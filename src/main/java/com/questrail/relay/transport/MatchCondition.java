package com.questrail.relay.transport;

/**
 * MatchCondition
 * -----------------------------------------------------------------------------
 * Predicate over an accumulating read buffer that decides when enough bytes have
 * arrived to satisfy a {@link StreamConnection#readUntil} request.
 *
 * <p>Conditions are evaluated again after every chunk the socket delivers, always
 * over the whole unconsumed window. A condition must therefore be a pure function
 * of {@code buffer[offset, offset + length)}: the result may not depend on how the
 * bytes were split across socket reads.</p>
 *
 * <p>Implementations must not retain or modify {@code buffer}.</p>
 */
@FunctionalInterface
public interface MatchCondition
{
    /**
     * Evaluate the condition over {@code length} bytes of {@code buffer} starting
     * at {@code offset}.
     *
     * @param buffer accumulated bytes (only {@code [offset, offset + length)} is valid)
     * @param offset index of the first unconsumed byte
     * @param length number of valid bytes
     * @return the match position relative to {@code offset}, or a not-matched result
     */
    MatchResult evaluate(byte[] buffer, int offset, int length);
}
