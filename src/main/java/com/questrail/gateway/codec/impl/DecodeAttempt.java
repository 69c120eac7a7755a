package com.questrail.gateway.codec.impl;

/**
 * Tagged result of one decode tier.
 *
 * <p>A tier either applies (and yields timestamp, value and status code) or
 * does not apply, in which case the next tier is consulted. A timestamp of
 * {@code 0} means "none supplied".</p>
 */
record DecodeAttempt(boolean applied, long timestamp, Object value, int status)
{
    private static final DecodeAttempt NOT_APPLICABLE = new DecodeAttempt(false, 0L, null, 0);

    static DecodeAttempt notApplicable() {
        return NOT_APPLICABLE;
    }

    static DecodeAttempt wire(long timestamp, Object value, int status) {
        return new DecodeAttempt(true, timestamp, value, status);
    }

    static DecodeAttempt valueOnly(Object value) {
        return new DecodeAttempt(true, 0L, value, 0);
    }
}
