package com.questrail.prt7.observability;

import com.questrail.prt7.model.DataFrame;
import com.questrail.prt7.model.Prt7Frame;

import java.time.Instant;
import java.util.Optional;

/**
 * Record describing one successfully dispatched frame.
 *
 * @param timestamp      when the frame was processed (observability only)
 * @param frame          the dispatched frame
 * @param decodedSymbol  translated symbol for DATA frames, {@code null} otherwise
 * @param rotorSummary   rotor position after dispatch
 * @param bufferSnapshot assembly buffer content after dispatch
 */
public record FrameProcessedEvent(
    Instant timestamp,
    Prt7Frame frame,
    Character decodedSymbol,
    String rotorSummary,
    String bufferSnapshot
) {
    /**
     * Returns the decoded symbol, present only for DATA frames.
     */
    public Optional<Character> decoded() {
        return Optional.ofNullable(decodedSymbol);
    }

    public boolean isData() {
        return frame instanceof DataFrame;
    }
}
