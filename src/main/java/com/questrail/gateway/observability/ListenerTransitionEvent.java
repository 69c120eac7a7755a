package com.questrail.gateway.observability;

import com.questrail.gateway.transport.ListenerKind;
import com.questrail.gateway.transport.ListenerState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of one network listener.
 */
public record ListenerTransitionEvent(
    Instant timestamp,
    String listener,
    ListenerKind kind,
    String bindAddress,
    ListenerState oldState,
    ListenerState newState
) {
    public boolean isTerminal() {
        return newState.isTerminal();
    }
}
