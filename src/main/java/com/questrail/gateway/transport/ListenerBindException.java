package com.questrail.gateway.transport;

/**
 * The listener's bind address could not be bound (address in use, permission
 * denied, unresolvable host).
 */
public final class ListenerBindException extends ListenerException
{
    public ListenerBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
