package com.questrail.gateway.transport;

/**
 * A failure that terminates a single network listener.
 *
 * <p>Listener failures never affect sibling listeners and are reported
 * through the listener manager's error channel.</p>
 */
public class ListenerException extends RuntimeException
{
    public ListenerException(String message) {
        super(message);
    }

    public ListenerException(String message, Throwable cause) {
        super(message, cause);
    }
}
