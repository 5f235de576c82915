package com.questrail.prt7.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the decoder.
 *
 * @param timestamp when the error was observed
 * @param line      the offending input line, or {@code null} for transport errors
 * @param message   human-readable description
 * @param cause     underlying exception; may be {@code null}
 */
public record Prt7ErrorEvent(
    Instant timestamp,
    String line,
    String message,
    Throwable cause
) {
}
