package com.questrail.relay.transport;

import java.net.SocketAddress;

/**
 * StreamConnection
 * -----------------------------------------------------------------------------
 * Port for one connected stream socket with asynchronous, condition-driven reads
 * and whole-buffer writes.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>At most one {@link #readUntil} may be outstanding at a time. Reads are not
 *       pipelined: the next read is issued from (or after) the previous callback.</li>
 *   <li>Writes are queued and flushed in issue order.</li>
 *   <li>Every callback runs on the connection's own execution context. Calls made
 *       from any other thread are submitted to that context's task queue rather
 *       than touching the socket or the read buffer directly.</li>
 *   <li>After {@link #close()}, a pending read completes with an error and later
 *       writes complete with an error. Nothing is cancelled proactively.</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, plain NIO, or a test double.</p>
 */
public interface StreamConnection
{
    /**
     * Accumulate bytes until {@code condition} matches, then deliver the bytes up
     * to the match position. The callback runs exactly once.
     */
    void readUntil(MatchCondition condition, ReadCallback callback);

    /**
     * Send the whole buffer. The buffer is shared, never copied or modified.
     */
    void write(WriteBuffer data, WriteCallback callback);

    /**
     * Send a copy of {@code text} encoded as UTF-8.
     */
    default void write(String text, WriteCallback callback)
    {
        write(WriteBuffer.utf8(text), callback);
    }

    /**
     * Gracefully shut down both directions, then release the socket. Shutdown or
     * close failures are logged and never thrown.
     */
    void close();

    boolean isOpen();

    /**
     * Remote endpoint, or {@code null} if unknown.
     */
    SocketAddress remoteAddress();
}
