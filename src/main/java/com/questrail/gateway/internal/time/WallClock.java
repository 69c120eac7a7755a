package com.questrail.gateway.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of "now" for process value timestamps.
 *
 * <p>Timestamps of translated controller events and of client payloads that
 * carry no {@code ts} field are taken from this clock. Tests substitute a
 * fixed clock to make encoded payloads deterministic.</p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
