package com.questrail.prt7.observability;

import com.questrail.prt7.internal.exec.DecodeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of Prt7ObservabilitySink that emits logs via SLF4J.
 *
 * <p>Per-frame progress is logged at DEBUG, or at INFO when {@code verbose}.</p>
 */
public final class Slf4jPrt7ObservabilitySink implements Prt7ObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPrt7ObservabilitySink.class);

    private final boolean verbose;

    public Slf4jPrt7ObservabilitySink() {
        this(false);
    }

    public Slf4jPrt7ObservabilitySink(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void onFrameProcessed(FrameProcessedEvent event) {
        if (!verbose && !log.isDebugEnabled()) {
            return;
        }
        String line = event.decoded()
            .map(symbol -> String.format("Frame %s decoded as '%s' | %s | message: [%s]",
                event.frame().wireForm(), symbol, event.rotorSummary(), event.bufferSnapshot()))
            .orElseGet(() -> String.format("Frame %s | %s | message: [%s]",
                event.frame().wireForm(), event.rotorSummary(), event.bufferSnapshot()));
        if (verbose) {
            log.info(line);
        } else {
            log.debug(line);
        }
    }

    @Override
    public void onError(Prt7ErrorEvent event) {
        if (event.line() != null) {
            log.warn("PRT-7 frame skipped: '{}' ({})", event.line(), event.message());
        } else {
            log.error("PRT-7 Error: {}", event.message(), event.cause());
        }
    }

    @Override
    public void onTransportEvent(Prt7TransportEvent event) {
        log.info("PRT-7 Transport {}: {}", event.kind(), event.detail());
    }

    @Override
    public void onFinished(DecodeResult result) {
        log.info("PRT-7 decoding finished ({}): {} frames, {} malformed, final shift {}",
            result.stopReason(), result.framesProcessed(), result.malformedFrames(), result.finalShift());
        log.info("Hidden message: [{}]", result.message());
    }
}
