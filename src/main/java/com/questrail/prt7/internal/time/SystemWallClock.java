package com.questrail.prt7.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * {@link WallClock} reading the system clock. The runtime wires it into the
 * frame interpreter, the decoder loop and the TCP line source, which stamp
 * frame, error and transport events with it.
 */
public enum SystemWallClock implements WallClock
{
    INSTANCE;

    @Override
    public Instant now()
    {
        return Instant.now();
    }
}
