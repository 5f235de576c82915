package com.questrail.prt7.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Prt7PollingPolicy
 * -----------------------------------------------------------------------------
 * Operational polling configuration for the decoder loop and its transport.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>pollTimeout</b>: Upper bound a polling transport waits for a line
 *       before reporting that none is available. Applied by the transport, not
 *       by the decoder core.</li>
 *   <li><b>maxConsecutiveEmptyPolls</b>: Number of back-to-back empty polls after
 *       which the decoder treats the stream as ended. Any received line resets
 *       the count.</li>
 * </ul>
 */
public record Prt7PollingPolicy(
        Duration pollTimeout,
        int maxConsecutiveEmptyPolls
) {
    /**
     * Canonical constructor with validation.
     */
    public Prt7PollingPolicy {
        Objects.requireNonNull(pollTimeout, "pollTimeout");

        if (pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be non-negative");
        }
        if (maxConsecutiveEmptyPolls < 1) {
            throw new IllegalArgumentException("maxConsecutiveEmptyPolls must be at least 1");
        }
    }

    /**
     * Creates a policy with typical defaults for a live serial feed.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>pollTimeout: 100ms</li>
     *   <li>maxConsecutiveEmptyPolls: 50 (about five idle seconds)</li>
     * </ul>
     */
    public static Prt7PollingPolicy defaults() {
        return new Prt7PollingPolicy(Duration.ofMillis(100), 50);
    }
}
