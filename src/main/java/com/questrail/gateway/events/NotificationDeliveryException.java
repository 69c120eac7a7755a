package com.questrail.gateway.events;

/**
 * Thrown by {@link HandlerChain} after a full delivery pass in which at least
 * one handler failed. The first failure is the cause; later failures are
 * attached as suppressed exceptions.
 */
public final class NotificationDeliveryException extends RuntimeException
{
    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
