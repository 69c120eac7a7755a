package com.questrail.gateway.codec;

/**
 * Indicates that a process value could not be converted to the wire schema.
 *
 * This typically reflects:
 * <ul>
 *   <li>A value type outside the scalar set (boolean, number, string, null)</li>
 *   <li>A non-finite floating point value (NaN, infinity)</li>
 *   <li>A failure inside the JSON serializer</li>
 * </ul>
 */
public final class EncodingException extends RuntimeException
{
    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
