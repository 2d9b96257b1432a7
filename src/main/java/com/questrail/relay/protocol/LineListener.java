package com.questrail.relay.protocol;

/**
 * Receives lines from a {@link LineMessageReader} receive loop.
 */
public interface LineListener
{
    /**
     * A complete line, without its terminator.
     */
    void onLine(String line);

    /**
     * The receive loop stopped. Called at most once.
     */
    void onFailure(Throwable cause);
}
