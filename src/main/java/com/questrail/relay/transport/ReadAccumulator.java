package com.questrail.relay.transport;

import java.util.Arrays;
import java.util.Objects;

/**
 * ReadAccumulator
 * =============================================================================
 * Transport-neutral core of {@link StreamConnection#readUntil}: the incoming byte
 * accumulation buffer plus the (single) pending read request.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@link #append} adds bytes delivered by the socket and re-evaluates the
 *       pending condition.</li>
 *   <li>When the condition matches, exactly {@code position} bytes are removed from
 *       the front of the buffer and handed to the callback. The remainder stays
 *       buffered for the next request.</li>
 *   <li>{@link #fail} records a terminal error. The pending read (and any later read
 *       that buffered bytes cannot satisfy) completes with that error.</li>
 * </ul>
 *
 * <p>The pending request is cleared <em>before</em> its callback runs, so a
 * callback may immediately issue the next {@link #readUntil}. Completion is a
 * drain loop: a {@code readUntil} issued from inside a callback only registers
 * the request, and the loop that is already running satisfies it once the
 * callback returns. Any number of requests already satisfiable from the buffer
 * are therefore delivered at constant stack depth.</p>
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. Every method must be called from the single execution context
 * that owns the connection (for Netty, the channel's event loop).
 */
public final class ReadAccumulator
{
    private static final int INITIAL_CAPACITY = 1 << 10;
    private static final byte[] EMPTY = new byte[0];

    // Unconsumed bytes are buffer[start, start + length).
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int length;

    private MatchCondition pendingCondition;
    private ReadCallback pendingCallback;

    private Throwable terminalError;

    // Set while drain() is delivering; nested calls only update state.
    private boolean draining;

    /**
     * Register a read request.
     *
     * @throws IllegalStateException if a read is already outstanding
     */
    public void readUntil(MatchCondition condition, ReadCallback callback)
    {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(callback, "callback");

        if (pendingCallback != null) {
            throw new IllegalStateException("A read is already outstanding on this connection");
        }

        pendingCondition = condition;
        pendingCallback = callback;
        drain();
    }

    /**
     * Append bytes received from the socket. Bytes arriving after a terminal error
     * are discarded.
     */
    public void append(byte[] src, int offset, int count)
    {
        Objects.requireNonNull(src, "src");
        Objects.checkFromIndexSize(offset, count, src.length);

        if (terminalError != null || count == 0) {
            return;
        }

        ensureCapacity(count);
        System.arraycopy(src, offset, buffer, start + length, count);
        length += count;

        drain();
    }

    public void append(byte[] src)
    {
        append(src, 0, src.length);
    }

    /**
     * Record a terminal error (EOF, reset, local close). Only the first cause is kept.
     */
    public void fail(Throwable cause)
    {
        Objects.requireNonNull(cause, "cause");
        if (terminalError == null) {
            terminalError = cause;
        }
        drain();
    }

    public boolean isReadPending()
    {
        return pendingCallback != null;
    }

    public boolean isFailed()
    {
        return terminalError != null;
    }

    /**
     * Number of bytes received but not yet consumed by a read.
     */
    public int buffered()
    {
        return length;
    }

    private void drain()
    {
        if (draining) {
            return;
        }

        draining = true;
        try {
            while (deliverOne()) {
                // keep going until nothing more is satisfiable
            }
        }
        finally {
            draining = false;
        }
    }

    /**
     * Complete the pending request if the buffer or a terminal error allows it.
     *
     * @return {@code true} if a callback ran
     */
    private boolean deliverOne()
    {
        final ReadCallback callback = pendingCallback;
        if (callback == null) {
            return false;
        }

        final MatchResult result = pendingCondition.evaluate(buffer, start, length);
        if (result.matched()) {
            final int position = result.position();
            if (position > length) {
                throw new IllegalStateException(
                        pendingCondition + " matched past the buffered data (" + position + " > " + length + ")");
            }

            final byte[] data = Arrays.copyOfRange(buffer, start, start + position);
            start += position;
            length -= position;
            if (length == 0) {
                start = 0;
            }

            clearPending();
            callback.onRead(null, data);
            return true;
        }

        if (terminalError != null) {
            clearPending();
            callback.onRead(terminalError, EMPTY);
            return true;
        }
        return false;
    }

    private void clearPending()
    {
        pendingCondition = null;
        pendingCallback = null;
    }

    /**
     * Make room for {@code extra} more bytes after the unconsumed window, sliding the
     * window to the front before growing.
     */
    private void ensureCapacity(int extra)
    {
        if (start + length + extra <= buffer.length) {
            return;
        }
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, length);
            start = 0;
        }
        final int required = length + extra;
        if (required > buffer.length) {
            int capacity = buffer.length;
            while (capacity < required) {
                capacity = (capacity > Integer.MAX_VALUE / 2) ? Integer.MAX_VALUE : capacity * 2;
            }
            buffer = Arrays.copyOf(buffer, capacity);
        }
    }
}
