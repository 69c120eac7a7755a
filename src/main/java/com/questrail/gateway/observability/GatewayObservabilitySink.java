package com.questrail.gateway.observability;

/**
 * Main interface for receiving gateway observability events.
 *
 * <p>Components never log directly. They receive a sink at construction so
 * that production wiring can route events to SLF4J and tests can capture
 * them. Implementations can provide logging, metrics, or tracing.</p>
 *
 * <p>Implementations must be thread-safe: listener tasks, Netty event loops
 * and publishing callers report concurrently.</p>
 */
public interface GatewayObservabilitySink {
    /**
     * Called when a network listener changes lifecycle state.
     * @param event the transition details
     */
    void onListenerTransition(ListenerTransitionEvent event);

    /**
     * Called when an MQTT client connects or disconnects.
     * @param event the connection event
     */
    void onClientConnection(ClientConnectionEvent event);

    /**
     * Called for every message accepted by the broker.
     * @param event the publication
     */
    void onPublish(PublishEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(GatewayErrorEvent event);
}
