package com.questrail.prt7.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for event timestamps.
 *
 * <p>
 * Decoding never depends on time; this clock only stamps observability events.
 * Tests substitute a fixed instant.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
