package com.questrail.relay.config;

import java.util.Objects;

/**
 * Configuration for the interactive client.
 *
 * @param host            server host name or address
 * @param port            server port
 * @param escapeCharacter first character of a console line that carries an explicit command
 */
public record RelayClientConfig(
    String host,
    int port,
    char escapeCharacter
) {
    public static final char DEFAULT_ESCAPE = '\\';

    public RelayClientConfig {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = RelayServerConfig.DEFAULT_PORT;
        private char escapeCharacter = DEFAULT_ESCAPE;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withEscapeCharacter(char escapeCharacter) {
            this.escapeCharacter = escapeCharacter;
            return this;
        }

        public RelayClientConfig build() {
            return new RelayClientConfig(host, port, escapeCharacter);
        }
    }
}
