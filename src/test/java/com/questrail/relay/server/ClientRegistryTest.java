package com.questrail.relay.server;

import com.questrail.relay.protocol.FramedMessageReader;
import com.questrail.relay.transport.FakeStreamConnection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientRegistryTest
{
    private static ClientRecord record(String name)
    {
        FakeStreamConnection connection = new FakeStreamConnection();
        return new ClientRecord(connection, new FramedMessageReader(connection, 64), name);
    }

    @Test
    void membershipIsByIdentity()
    {
        ClientRegistry registry = new ClientRegistry();
        ClientRecord a = record("same");
        ClientRecord b = record("same");

        assertTrue(registry.add(a));
        assertTrue(registry.add(b));
        assertFalse(registry.add(a));
        assertEquals(2, registry.size());
    }

    @Test
    void removeReportsWhetherPresent()
    {
        ClientRegistry registry = new ClientRegistry();
        ClientRecord a = record("a");
        registry.add(a);

        assertTrue(registry.remove(a));
        assertFalse(registry.remove(a));
        assertTrue(registry.isEmpty());
    }

    @Test
    void peersExcludeSenderOnly()
    {
        ClientRegistry registry = new ClientRegistry();
        ClientRecord a = record("a");
        ClientRecord b = record("b");
        ClientRecord c = record("c");
        registry.add(a);
        registry.add(b);
        registry.add(c);

        List<ClientRecord> peers = registry.peersOf(b);

        assertEquals(2, peers.size());
        assertTrue(peers.contains(a));
        assertTrue(peers.contains(c));
    }

    @Test
    void snapshotIsDetachedFromRegistry()
    {
        ClientRegistry registry = new ClientRegistry();
        ClientRecord a = record("a");
        registry.add(a);

        List<ClientRecord> snapshot = registry.snapshot();
        registry.remove(a);

        assertEquals(List.of(a), snapshot);
    }
}
