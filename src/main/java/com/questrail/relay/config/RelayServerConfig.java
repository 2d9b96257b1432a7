package com.questrail.relay.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Configuration for the relay server.
 *
 * @param bindAddress      address the listener binds to
 * @param defaultName      display name of a client until it renames itself
 * @param maxPayloadLength largest frame payload accepted; a longer header drops the client
 */
public record RelayServerConfig(
    InetSocketAddress bindAddress,
    String defaultName,
    int maxPayloadLength
) {
    public static final int DEFAULT_PORT = 8888;
    public static final String DEFAULT_NAME = "<unknown>";
    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 16 * 1024 * 1024;

    public RelayServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(defaultName, "defaultName");
        if (maxPayloadLength < 0) {
            throw new IllegalArgumentException("maxPayloadLength must be >= 0: " + maxPayloadLength);
        }
    }

    /**
     * All interfaces, port 8888, default name and payload limit.
     */
    public static RelayServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private String defaultName = DEFAULT_NAME;
        private int maxPayloadLength = DEFAULT_MAX_PAYLOAD_LENGTH;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPort(int port) {
            this.bindAddress = new InetSocketAddress(port);
            return this;
        }

        public Builder withDefaultName(String defaultName) {
            this.defaultName = defaultName;
            return this;
        }

        public Builder withMaxPayloadLength(int maxPayloadLength) {
            this.maxPayloadLength = maxPayloadLength;
            return this;
        }

        public RelayServerConfig build() {
            return new RelayServerConfig(bindAddress, defaultName, maxPayloadLength);
        }
    }
}
