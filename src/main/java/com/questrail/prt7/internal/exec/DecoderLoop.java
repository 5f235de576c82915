package com.questrail.prt7.internal.exec;

import com.questrail.prt7.core.AssemblyBuffer;
import com.questrail.prt7.core.SubstitutionRotor;
import com.questrail.prt7.internal.time.WallClock;
import com.questrail.prt7.observability.Prt7ErrorEvent;
import com.questrail.prt7.observability.Prt7ObservabilitySink;
import com.questrail.prt7.transport.LineSource;
import com.questrail.prt7.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * DecoderLoop
 * =============================================================================
 * Boundary orchestrator that drives one decoding run to completion.
 *
 * <h2>State machine</h2>
 * <pre>
 *   RUNNING ──(END frame)──────────────→ STOPPED [TERMINATED]
 *   RUNNING ──(source exhausted)───────→ STOPPED [END_OF_STREAM]
 *   RUNNING ──(N empty polls in a row)─→ STOPPED [IDLE_LIMIT]
 *   RUNNING ──(transport failure)──────→ STOPPED [TRANSPORT_FAILURE]
 * </pre>
 *
 * <h2>Ownership</h2>
 * The loop exclusively owns its {@link SubstitutionRotor} and
 * {@link AssemblyBuffer}; the {@link FrameInterpreter} only borrows them per
 * line. A loop runs once.
 *
 * <h2>Threading Model</h2>
 * Single-threaded and synchronous. The loop never sleeps; any waiting happens
 * inside {@link LineSource#nextLine()}. Early cancellation is achieved by
 * closing the source so that it reports end of stream.
 */
public final class DecoderLoop
{
    private static final Logger log = LoggerFactory.getLogger(DecoderLoop.class);

    private final LineSource source;
    private final FrameInterpreter interpreter;
    private final Prt7PollingPolicy pollingPolicy;
    private final Prt7ObservabilitySink observabilitySink;
    private final WallClock clock;

    private final SubstitutionRotor rotor = new SubstitutionRotor();
    private final AssemblyBuffer buffer = new AssemblyBuffer();

    private DecoderState state = DecoderState.RUNNING;
    private boolean started;
    private int framesProcessed;
    private int malformedFrames;

    public DecoderLoop(LineSource source,
                       FrameInterpreter interpreter,
                       Prt7PollingPolicy pollingPolicy,
                       Prt7ObservabilitySink observabilitySink,
                       WallClock clock)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.pollingPolicy = Objects.requireNonNull(pollingPolicy, "pollingPolicy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs the loop until it stops.
     *
     * <p>The rendered message is handed to
     * {@link Prt7ObservabilitySink#onFinished(DecodeResult)} before this method
     * returns or throws.</p>
     *
     * @return the final message and run statistics
     * @throws TransportFailureException if the source fails; the partial message
     *         has already been reported through the sink
     * @throws IllegalStateException if the loop has already been run
     */
    public DecodeResult run()
    {
        if (started) {
            throw new IllegalStateException("DecoderLoop can only be run once");
        }
        started = true;

        log.debug("Decoder loop started");
        int emptyPolls = 0;
        StopReason reason = null;

        while (state == DecoderState.RUNNING) {
            final Optional<String> line;
            try {
                line = source.nextLine();
            }
            catch (TransportFailureException e) {
                observabilitySink.onError(new Prt7ErrorEvent(clock.now(), null, e.getMessage(), e));
                finish(StopReason.TRANSPORT_FAILURE);
                throw e;
            }

            if (line.isPresent()) {
                emptyPolls = 0;
                ContinueSignal signal = interpreter.interpret(line.get(), rotor, buffer);
                if (signal == ContinueSignal.SKIPPED) {
                    malformedFrames++;
                }
                else {
                    framesProcessed++;
                }
                if (!signal.shouldContinue()) {
                    reason = StopReason.TERMINATED;
                }
            }
            else if (source.isExhausted()) {
                reason = StopReason.END_OF_STREAM;
            }
            else if (++emptyPolls >= pollingPolicy.maxConsecutiveEmptyPolls()) {
                log.debug("No line after {} consecutive polls", emptyPolls);
                reason = StopReason.IDLE_LIMIT;
            }

            if (reason != null) {
                return finish(reason);
            }
        }

        throw new IllegalStateException("DecoderLoop stopped without a reason");
    }

    public DecoderState state()
    {
        return state;
    }

    /**
     * Current rotor shift; intended for diagnostics and tests.
     */
    public int currentShift()
    {
        return rotor.shift();
    }

    /**
     * Message assembled so far.
     */
    public String currentMessage()
    {
        return buffer.render();
    }

    private DecodeResult finish(StopReason reason)
    {
        state = DecoderState.STOPPED;

        DecodeResult result = new DecodeResult(
                buffer.render(),
                reason,
                framesProcessed,
                malformedFrames,
                rotor.shift()
        );
        log.debug("Decoder loop stopped: {}", reason);
        observabilitySink.onFinished(result);
        return result;
    }
}
