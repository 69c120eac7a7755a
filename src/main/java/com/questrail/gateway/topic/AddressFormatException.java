package com.questrail.gateway.topic;

/**
 * Indicates that a controller address or parameter name cannot be mapped to a
 * topic, e.g. a device address without exactly one {@code ':'} separator.
 */
public final class AddressFormatException extends RuntimeException
{
    public AddressFormatException(String message) {
        super(message);
    }
}
