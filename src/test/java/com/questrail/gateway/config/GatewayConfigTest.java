package com.questrail.gateway.config;

import com.questrail.gateway.api.PublishDecision;
import com.questrail.gateway.transport.ListenerKind;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class GatewayConfigTest
{
    @Test
    void readsAllListenersFromProperties()
    {
        Properties p = new Properties();
        p.setProperty(GatewayConfig.MQTT_ADDRESS, ":1883");
        p.setProperty(GatewayConfig.MQTT_TLS_ADDRESS, ":8883");
        p.setProperty(GatewayConfig.MQTT_TLS_CERT_FILE, "/etc/gw/cert.pem");
        p.setProperty(GatewayConfig.MQTT_TLS_KEY_FILE, "/etc/gw/key.pem");
        p.setProperty(GatewayConfig.MQTT_WS_ADDRESS, ":9001");

        GatewayConfig config = GatewayConfig.fromProperties(p);
        List<ListenerConfig> listeners = config.broker().listeners();

        assertEquals(3, listeners.size());
        assertEquals(ListenerKind.PLAIN, listeners.get(0).kind());
        assertEquals(1883, listeners.get(0).bindAddress().getPort());

        assertEquals(ListenerKind.TLS, listeners.get(1).kind());
        assertEquals(Path.of("/etc/gw/cert.pem"), listeners.get(1).certFile());
        assertEquals(Path.of("/etc/gw/key.pem"), listeners.get(1).keyFile());

        assertEquals(ListenerKind.WEBSOCKET, listeners.get(2).kind());
        assertEquals(ListenerConfig.DEFAULT_WEBSOCKET_PATH, listeners.get(2).path());
    }

    @Test
    void missingAddressesDisableListeners()
    {
        Properties p = new Properties();
        p.setProperty(GatewayConfig.MQTT_ADDRESS, ":1883");
        p.setProperty(GatewayConfig.MQTT_TLS_ADDRESS, "  ");

        GatewayConfig config = GatewayConfig.fromProperties(p);

        assertEquals(1, config.broker().listeners().size());
        assertEquals("mqtt", config.broker().listeners().get(0).name());
    }

    @Test
    void tlsListenerRequiresCertificateAndKey()
    {
        Properties p = new Properties();
        p.setProperty(GatewayConfig.MQTT_TLS_ADDRESS, ":8883");
        p.setProperty(GatewayConfig.MQTT_TLS_CERT_FILE, "/etc/gw/cert.pem");

        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromProperties(p));
    }

    @Test
    void transientParametersExtendPolicy()
    {
        Properties p = new Properties();
        p.setProperty(GatewayConfig.TRANSIENT_PARAMETERS, "MOTION_EVENT, KEY_* ,");

        GatewayConfig config = GatewayConfig.fromProperties(p);

        assertEquals(PublishDecision.TRANSIENT, config.publishPolicy().resolve("MOTION_EVENT"));
        assertEquals(PublishDecision.TRANSIENT, config.publishPolicy().resolve("KEY_LONG"));
        assertEquals(PublishDecision.TRANSIENT, config.publishPolicy().resolve("PRESS_SHORT"));
        assertEquals(PublishDecision.STEADY_STATE, config.publishPolicy().resolve("LEVEL"));
    }

    @Test
    void maxMessageSizeIsValidated()
    {
        Properties p = new Properties();
        p.setProperty(GatewayConfig.MQTT_MAX_MESSAGE_SIZE, "4096");
        assertEquals(4096, GatewayConfig.fromProperties(p).broker().maxMessageSize());

        p.setProperty(GatewayConfig.MQTT_MAX_MESSAGE_SIZE, "big");
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromProperties(p));

        p.setProperty(GatewayConfig.MQTT_MAX_MESSAGE_SIZE, "0");
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromProperties(p));
    }

    @Test
    void brokerConfigRejectsDuplicateListenerNames()
    {
        BrokerConfig.Builder b = BrokerConfig.builder()
            .withPlainListener(BindAddresses.parse(":1883"))
            .withPlainListener(BindAddresses.parse(":1884"));

        assertThrows(IllegalArgumentException.class, b::build);
    }

    @Test
    void brokerConfigDefaults()
    {
        BrokerConfig config = BrokerConfig.builder().build();

        assertTrue(config.listeners().isEmpty());
        assertEquals(BrokerConfig.DEFAULT_MAX_MESSAGE_SIZE, config.maxMessageSize());
        assertEquals(Duration.ofSeconds(30), config.connectTimeout());
    }
}
