package com.questrail.relay.codec;

/**
 * Indicates that bytes read from a connection could not be interpreted as a
 * valid frame header.
 *
 * This typically reflects:
 * <ul>
 *   <li>A header of the wrong size</li>
 *   <li>A payload length beyond the configured maximum</li>
 * </ul>
 *
 * The connection it was read from is treated as failed.
 */
public final class FrameDecodeException extends RuntimeException
{
    public FrameDecodeException(String message)
    {
        super(message);
    }

    public FrameDecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
