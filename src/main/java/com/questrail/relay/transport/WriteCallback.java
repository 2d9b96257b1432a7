package com.questrail.relay.transport;

/**
 * Completion callback for {@link StreamConnection#write}.
 */
@FunctionalInterface
public interface WriteCallback
{
    /** Fire-and-forget: completion is ignored. */
    WriteCallback NONE = (error, bytesWritten) -> { };

    /**
     * Called exactly once, after the whole buffer has been handed to the socket or
     * an unrecoverable error occurred.
     *
     * @param error        {@code null} on success
     * @param bytesWritten number of bytes written; {@code 0} on error
     */
    void onWrite(Throwable error, int bytesWritten);
}
