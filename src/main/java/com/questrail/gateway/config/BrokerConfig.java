package com.questrail.gateway.config;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of the embedded MQTT broker.
 *
 * @param listeners      listeners to start; may be empty
 * @param maxMessageSize maximum size of an inbound MQTT packet in bytes
 * @param connectTimeout time a new connection has to send CONNECT
 */
public record BrokerConfig(
    List<ListenerConfig> listeners,
    int maxMessageSize,
    Duration connectTimeout
) {
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 1024 * 1024;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    public BrokerConfig {
        listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners"));
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive");
        }
        Set<String> names = new HashSet<>();
        for (ListenerConfig l : listeners) {
            if (!names.add(l.name())) {
                throw new IllegalArgumentException("Duplicate listener name: " + l.name());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<ListenerConfig> listeners = new ArrayList<>();
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

        public Builder withListener(ListenerConfig listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder withPlainListener(InetSocketAddress bindAddress) {
            return withListener(ListenerConfig.plain(bindAddress));
        }

        public Builder withTlsListener(InetSocketAddress bindAddress, Path certFile, Path keyFile) {
            return withListener(ListenerConfig.tls(bindAddress, certFile, keyFile));
        }

        public Builder withWebSocketListener(InetSocketAddress bindAddress, String path) {
            return withListener(ListenerConfig.webSocket(bindAddress, path));
        }

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(listeners, maxMessageSize, connectTimeout);
        }
    }
}
