package com.questrail.brickhub.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Address and timing of the BLE bridge process reached over TCP.
 */
public record BridgeConfig(
        String host,
        int port,
        Duration connectTimeout
) {
    public BridgeConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    public static BridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = 9090;
        private Duration connectTimeout = Duration.ofSeconds(5);

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(host, port, connectTimeout);
        }
    }
}
