package com.questrail.gateway.observability;

import java.time.Instant;

/**
 * Record representing an MQTT client session being opened or closed.
 *
 * @param graceful for closed sessions, whether the client sent DISCONNECT
 */
public record ClientConnectionEvent(
    Instant timestamp,
    String clientId,
    String remoteAddress,
    boolean connected,
    boolean graceful
) {
}
