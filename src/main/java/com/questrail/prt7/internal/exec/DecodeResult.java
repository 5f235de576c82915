package com.questrail.prt7.internal.exec;

import java.util.Objects;

/**
 * Final outcome of one decoder run.
 *
 * @param message         rendered assembly buffer content
 * @param stopReason      why the loop stopped
 * @param framesProcessed frames successfully dispatched, including {@code END}
 * @param malformedFrames lines skipped as malformed
 * @param finalShift      rotor shift when the loop stopped
 */
public record DecodeResult(
        String message,
        StopReason stopReason,
        int framesProcessed,
        int malformedFrames,
        int finalShift
) {
    public DecodeResult {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(stopReason, "stopReason");
        if (framesProcessed < 0 || malformedFrames < 0) {
            throw new IllegalArgumentException("frame counters must be non-negative");
        }
    }
}
