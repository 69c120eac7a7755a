package com.questrail.gateway.config;

import com.questrail.gateway.topic.PublishPolicy;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Aggregated configuration for the gateway runtime.
 */
public record GatewayConfig(
    BrokerConfig broker,
    PublishPolicy publishPolicy
) {
    public static final String MQTT_ADDRESS = "mqtt.address";
    public static final String MQTT_TLS_ADDRESS = "mqtt.tls.address";
    public static final String MQTT_TLS_CERT_FILE = "mqtt.tls.certFile";
    public static final String MQTT_TLS_KEY_FILE = "mqtt.tls.keyFile";
    public static final String MQTT_WS_ADDRESS = "mqtt.ws.address";
    public static final String MQTT_WS_PATH = "mqtt.ws.path";
    public static final String MQTT_MAX_MESSAGE_SIZE = "mqtt.maxMessageSize";
    public static final String TRANSIENT_PARAMETERS = "mqtt.transientParameters";

    public GatewayConfig {
        Objects.requireNonNull(broker, "broker");
        Objects.requireNonNull(publishPolicy, "publishPolicy");
    }

    /**
     * Reads the flat key file format. A listener whose address key is missing
     * or blank is not started.
     *
     * <p>{@value #TRANSIENT_PARAMETERS} is a comma separated list of additional
     * transient parameter names; entries ending in {@code *} are prefixes.</p>
     *
     * @throws IllegalArgumentException on malformed values
     */
    public static GatewayConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        BrokerConfig.Builder broker = BrokerConfig.builder();

        String addr = blankToNull(props.getProperty(MQTT_ADDRESS));
        if (addr != null) {
            broker.withPlainListener(BindAddresses.parse(addr));
        }

        String tlsAddr = blankToNull(props.getProperty(MQTT_TLS_ADDRESS));
        if (tlsAddr != null) {
            String cert = blankToNull(props.getProperty(MQTT_TLS_CERT_FILE));
            String key = blankToNull(props.getProperty(MQTT_TLS_KEY_FILE));
            if (cert == null || key == null) {
                throw new IllegalArgumentException(MQTT_TLS_ADDRESS + " requires "
                        + MQTT_TLS_CERT_FILE + " and " + MQTT_TLS_KEY_FILE);
            }
            broker.withTlsListener(BindAddresses.parse(tlsAddr), Path.of(cert), Path.of(key));
        }

        String wsAddr = blankToNull(props.getProperty(MQTT_WS_ADDRESS));
        if (wsAddr != null) {
            String path = props.getProperty(MQTT_WS_PATH, ListenerConfig.DEFAULT_WEBSOCKET_PATH).trim();
            broker.withWebSocketListener(BindAddresses.parse(wsAddr), path);
        }

        String maxSize = blankToNull(props.getProperty(MQTT_MAX_MESSAGE_SIZE));
        if (maxSize != null) {
            try {
                broker.withMaxMessageSize(Integer.parseInt(maxSize));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + MQTT_MAX_MESSAGE_SIZE + ": " + maxSize, e);
            }
        }

        Set<String> names = new LinkedHashSet<>();
        Set<String> prefixes = new LinkedHashSet<>();
        String transients = blankToNull(props.getProperty(TRANSIENT_PARAMETERS));
        if (transients != null) {
            Arrays.stream(transients.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(s -> {
                        if (s.endsWith("*")) {
                            prefixes.add(s.substring(0, s.length() - 1));
                        } else {
                            names.add(s);
                        }
                    });
        }

        return new GatewayConfig(broker.build(), PublishPolicy.withTransient(names, prefixes));
    }

    private static String blankToNull(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        return s.trim();
    }
}
