package com.questrail.relay.transport;

/**
 * Completion callback for {@link StreamConnection#readUntil}.
 */
@FunctionalInterface
public interface ReadCallback
{
    /**
     * Called exactly once per read request.
     *
     * @param error {@code null} on success; otherwise the read failure (EOF is
     *              reported as {@link ConnectionClosedException})
     * @param data  the bytes up to and including the match position; empty on error
     */
    void onRead(Throwable error, byte[] data);
}
