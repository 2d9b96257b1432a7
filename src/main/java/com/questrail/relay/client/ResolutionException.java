package com.questrail.relay.client;

/**
 * The server host name could not be resolved to any address.
 */
public final class ResolutionException extends RuntimeException
{
    public ResolutionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
