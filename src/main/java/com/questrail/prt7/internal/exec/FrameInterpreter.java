package com.questrail.prt7.internal.exec;

import com.questrail.prt7.codec.MalformedFrameException;
import com.questrail.prt7.codec.Prt7FrameDecoder;
import com.questrail.prt7.core.AssemblyBuffer;
import com.questrail.prt7.core.SubstitutionRotor;
import com.questrail.prt7.internal.time.WallClock;
import com.questrail.prt7.model.DataFrame;
import com.questrail.prt7.model.Prt7Frame;
import com.questrail.prt7.model.RemapFrame;
import com.questrail.prt7.model.TerminateFrame;
import com.questrail.prt7.observability.FrameProcessedEvent;
import com.questrail.prt7.observability.Prt7ErrorEvent;
import com.questrail.prt7.observability.Prt7ObservabilitySink;

import java.util.Objects;

/**
 * FrameInterpreter
 * =============================================================================
 * Classifies one input line and dispatches it against a rotor and a buffer.
 *
 * <h2>Dispatch</h2>
 * <pre>
 *   DataFrame(c)      → buffer.append(rotor.map(c))   → CONTINUE
 *   RemapFrame(d)     → rotor.rotate(d)               → CONTINUE
 *   TerminateFrame    → (no mutation)                 → STOP
 *   malformed line    → (no mutation, error reported) → SKIPPED
 * </pre>
 *
 * <h2>State</h2>
 * The interpreter holds no decoding history. The rotor and buffer are borrowed
 * per call; their owner is the {@link DecoderLoop}. The only side effects
 * besides rotor/buffer mutation are observability callbacks.
 */
public final class FrameInterpreter
{
    private final Prt7FrameDecoder decoder;
    private final Prt7ObservabilitySink observabilitySink;
    private final WallClock clock;

    public FrameInterpreter(Prt7FrameDecoder decoder,
                            Prt7ObservabilitySink observabilitySink,
                            WallClock clock)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Parse {@code line} and apply the resulting frame.
     *
     * @param line   one input line, terminator removed
     * @param rotor  rotor to translate with or rotate
     * @param buffer buffer receiving decoded symbols
     * @return whether the decoder should keep reading
     */
    public ContinueSignal interpret(String line, SubstitutionRotor rotor, AssemblyBuffer buffer)
    {
        Objects.requireNonNull(rotor, "rotor");
        Objects.requireNonNull(buffer, "buffer");

        final Prt7Frame frame;
        try {
            frame = decoder.decode(line);
        }
        catch (MalformedFrameException e) {
            observabilitySink.onError(new Prt7ErrorEvent(clock.now(), e.line(), e.getMessage(), e));
            return ContinueSignal.SKIPPED;
        }

        Character decoded = null;
        final ContinueSignal signal;

        if (frame instanceof DataFrame data) {
            decoded = rotor.map(data.symbol());
            buffer.append(decoded);
            signal = ContinueSignal.CONTINUE;
        }
        else if (frame instanceof RemapFrame remap) {
            rotor.rotate(remap.delta());
            signal = ContinueSignal.CONTINUE;
        }
        else if (frame instanceof TerminateFrame) {
            signal = ContinueSignal.STOP;
        }
        else {
            throw new IllegalStateException("Unhandled frame type: " + frame);
        }

        observabilitySink.onFrameProcessed(new FrameProcessedEvent(
                clock.now(),
                frame,
                decoded,
                rotor.describe(),
                buffer.render()
        ));

        return signal;
    }
}
