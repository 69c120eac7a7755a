package com.questrail.gateway.transport;

/**
 * Lifecycle state of a network listener.
 *
 * <pre>
 *   CREATED → STARTING → RUNNING → STOPPING → STOPPED
 *                 ↓          ↓
 *               FAILED     FAILED
 * </pre>
 */
public enum ListenerState
{
    CREATED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
