package com.questrail.relay.client;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a host name into the candidate endpoints a client tries in order.
 */
@FunctionalInterface
public interface HostResolver
{
    /**
     * @return every address of {@code host} paired with {@code port}; never empty
     * @throws ResolutionException if the host cannot be resolved
     */
    List<InetSocketAddress> resolve(String host, int port);

    /**
     * Resolver backed by the platform name service.
     */
    static HostResolver system()
    {
        return (host, port) -> {
            final InetAddress[] addresses;
            try {
                addresses = InetAddress.getAllByName(host);
            }
            catch (UnknownHostException e) {
                throw new ResolutionException("Cannot resolve " + host, e);
            }

            List<InetSocketAddress> candidates = new ArrayList<>(addresses.length);
            for (InetAddress address : addresses) {
                candidates.add(new InetSocketAddress(address, port));
            }
            if (candidates.isEmpty()) {
                throw new ResolutionException("No addresses for " + host, null);
            }
            return candidates;
        };
    }
}
