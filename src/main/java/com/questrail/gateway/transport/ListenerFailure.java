package com.questrail.gateway.transport;

import java.time.Instant;

/**
 * Terminal failure of one listener, as delivered on the error channel.
 */
public record ListenerFailure(
    Instant timestamp,
    String listener,
    ListenerKind kind,
    ListenerException cause
) {
}
