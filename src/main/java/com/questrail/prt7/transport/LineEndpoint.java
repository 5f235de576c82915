package com.questrail.prt7.transport;

/**
 * LineEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a push-style, line-framed transport (TCP serial bridge,
 * simulator, or test harness).
 *
 * <p>Higher layers are responsible for buffering delivered lines until the
 * decoder loop asks for them; see {@code QueuedLineSource}.</p>
 */
public interface LineEndpoint
{
    /**
     * Start the endpoint and begin receiving lines.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link LineEndpointListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link LineEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void stop();

    /**
     * Register the listener that receives lines and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(LineEndpointListener listener);

    /**
     * Human-readable description of the remote side, for diagnostics.
     */
    String describe();
}
