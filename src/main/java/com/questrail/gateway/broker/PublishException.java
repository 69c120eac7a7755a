package com.questrail.gateway.broker;

/**
 * A publication was rejected by the broker: structurally invalid topic,
 * invalid QoS level, or broker not running.
 */
public final class PublishException extends RuntimeException
{
    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
