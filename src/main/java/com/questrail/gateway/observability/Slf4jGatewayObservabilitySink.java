package com.questrail.gateway.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GatewayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGatewayObservabilitySink implements GatewayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger("mqtt-server");

    @Override
    public void onListenerTransition(ListenerTransitionEvent event) {
        log.info("{} listener {} on {}: {} -> {}",
            event.kind(),
            event.listener(),
            event.bindAddress(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onClientConnection(ClientConnectionEvent event) {
        if (event.connected()) {
            log.debug("Client {} connected from {}", event.clientId(), event.remoteAddress());
        } else {
            log.debug("Client {} disconnected from {} ({})",
                event.clientId(),
                event.remoteAddress(),
                event.graceful() ? "graceful" : "connection lost");
        }
    }

    @Override
    public void onPublish(PublishEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("Publishing {}: {}", event.topic(), event.payloadText());
        }
    }

    @Override
    public void onError(GatewayErrorEvent event) {
        log.error("{}", event.message(), event.cause());
    }
}
