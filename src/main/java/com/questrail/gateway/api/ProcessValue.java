package com.questrail.gateway.api;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * ProcessValue
 * -----------------------------------------------------------------------------
 * A timestamped, status-tagged value of a controller data point or system
 * variable.
 *
 * <p>The value is dynamically typed. Values produced by the controller are
 * scalars ({@link Boolean}, {@link Number}, {@link String}) or {@code null}.
 * Values decoded from client payloads may additionally be structured
 * ({@link java.util.Map}, {@link java.util.List}) when a client publishes an
 * arbitrary JSON document.</p>
 *
 * <p>Numbers are held in one canonical form: integral values as {@link Long}
 * (or {@link BigInteger} beyond the {@code long} range) and floating point
 * values as {@link Double}. A value therefore compares equal to its decoded
 * wire form regardless of the boxed type it was created with.</p>
 */
public record ProcessValue(Instant timestamp, Object value, PvStatus status)
{
    public ProcessValue {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(status, "status");
        value = canonicalNumber(value);
    }

    /**
     * Creates a value with {@link PvStatus#GOOD} status.
     */
    public static ProcessValue good(Instant timestamp, Object value) {
        return new ProcessValue(timestamp, value, PvStatus.GOOD);
    }

    private static Object canonicalNumber(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        if (value instanceof BigDecimal dec) {
            return dec.doubleValue();
        }
        return value;
    }
}
