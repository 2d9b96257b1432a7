package com.questrail.relay;

/**
 * Process exit codes shared by the server and client command lines.
 *
 * <p>Each startup failure kind has its own code so scripts can tell them apart.</p>
 */
public enum ExitCode
{
    SUCCESS(0),
    BAD_ARGUMENTS(1),
    RESOLVER_FAILURE(2),
    CONNECTION_FAILURE(3),
    WRITE_FAILURE(4),
    READ_FAILURE(5),
    ACCEPTOR_FAILURE(6),
    STARTUP_FAILURE(7);

    private final int code;

    ExitCode(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }
}
