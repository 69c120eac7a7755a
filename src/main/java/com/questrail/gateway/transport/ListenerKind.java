package com.questrail.gateway.transport;

/**
 * Transport variant of a network listener.
 */
public enum ListenerKind
{
    /** MQTT over plain TCP. */
    PLAIN,
    /** MQTT over TLS. Requires certificate and private key files. */
    TLS,
    /** MQTT over WebSocket, for browser clients. */
    WEBSOCKET
}
