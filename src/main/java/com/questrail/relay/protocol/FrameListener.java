package com.questrail.relay.protocol;

import com.questrail.relay.codec.ChatFrame;

/**
 * Receives the outcome of one {@link FramedMessageReader#readMessage} call.
 * Exactly one of the two methods is invoked per call.
 */
public interface FrameListener
{
    void onFrame(ChatFrame frame);

    /**
     * The read failed (EOF, socket error, or an undecodable header). No further
     * reads should be issued on the connection.
     */
    void onFailure(Throwable cause);
}
