package com.questrail.gateway.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the gateway core.
 */
public record GatewayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
