package com.questrail.relay.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ClientRegistry
 * =============================================================================
 * The server's live set of connected clients.
 *
 * <h2>Invariant</h2>
 * A record is present iff its connection is open and has not yet reported a
 * terminal error or quit. {@link ChatDispatcher} is the only writer.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. The registry is confined to the server's single event loop,
 * which is the only thread that ever touches it.
 *
 * <p>Membership is by identity; iteration order is unspecified.</p>
 */
public final class ClientRegistry
{
    private final Set<ClientRecord> clients = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * @return {@code true} if the record was not already present
     */
    public boolean add(ClientRecord client)
    {
        return clients.add(Objects.requireNonNull(client, "client"));
    }

    /**
     * @return {@code true} if the record was present
     */
    public boolean remove(ClientRecord client)
    {
        return clients.remove(client);
    }

    public boolean contains(ClientRecord client)
    {
        return clients.contains(client);
    }

    public int size()
    {
        return clients.size();
    }

    public boolean isEmpty()
    {
        return clients.isEmpty();
    }

    /**
     * Returns a snapshot of every member except {@code sender}. The snapshot is
     * safe to iterate while the registry changes underneath it.
     */
    public List<ClientRecord> peersOf(ClientRecord sender)
    {
        List<ClientRecord> peers = new ArrayList<>(clients.size());
        for (ClientRecord client : clients) {
            if (client != sender) {
                peers.add(client);
            }
        }
        return peers;
    }

    /**
     * Returns a snapshot of all members.
     */
    public List<ClientRecord> snapshot()
    {
        return new ArrayList<>(clients);
    }
}
