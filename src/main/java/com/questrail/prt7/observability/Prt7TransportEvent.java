package com.questrail.prt7.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle change.
 *
 * @param timestamp when the change was observed
 * @param kind      what happened
 * @param detail    endpoint description or failure message
 */
public record Prt7TransportEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        UP,
        DOWN,
        FAILED
    }
}
