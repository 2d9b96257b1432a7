package com.questrail.relay.transport;

import java.io.IOException;

/**
 * Reported to a pending read when the stream ends (peer EOF or local close)
 * before the read's match condition was satisfied.
 */
public final class ConnectionClosedException extends IOException
{
    public ConnectionClosedException(String message)
    {
        super(message);
    }
}
