package com.questrail.prt7.observability;

import com.questrail.prt7.internal.exec.DecodeResult;

/**
 * Main interface for receiving PRT-7 decoder progress and results.
 * Implementations can provide logging, console output, or test recording.
 *
 * <p>All callbacks are purely observational; the decoder ignores anything
 * an implementation does with them.</p>
 */
public interface Prt7ObservabilitySink {
    /**
     * Called after a frame has been dispatched against the rotor and buffer.
     * @param event the frame, rotor position and buffer snapshot
     */
    void onFrameProcessed(FrameProcessedEvent event);

    /**
     * Called when a line is skipped as malformed or the transport fails.
     * @param event the error event
     */
    void onError(Prt7ErrorEvent event);

    /**
     * Called when a transport-level event occurs (connection up/down).
     * @param event the transport event
     */
    void onTransportEvent(Prt7TransportEvent event);

    /**
     * Called exactly once per decoder run with the rendered message.
     * @param result final message and run statistics
     */
    void onFinished(DecodeResult result);
}
