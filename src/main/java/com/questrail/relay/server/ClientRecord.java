package com.questrail.relay.server;

import com.questrail.relay.protocol.FramedMessageReader;
import com.questrail.relay.transport.StreamConnection;

import java.util.Objects;

/**
 * ClientRecord
 * -----------------------------------------------------------------------------
 * Server-side state for one connected client: its connection, its framed reader
 * and its mutable display name.
 *
 * <p>Records are compared by identity. All access happens on the server's event
 * loop.</p>
 */
public final class ClientRecord
{
    private final StreamConnection connection;
    private final FramedMessageReader reader;

    private String name;

    ClientRecord(StreamConnection connection, FramedMessageReader reader, String name)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.name = Objects.requireNonNull(name, "name");
    }

    public StreamConnection connection()
    {
        return connection;
    }

    FramedMessageReader reader()
    {
        return reader;
    }

    public String name()
    {
        return name;
    }

    void rename(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString()
    {
        return "ClientRecord[name=" + name + ", remote=" + connection.remoteAddress() + ']';
    }
}
