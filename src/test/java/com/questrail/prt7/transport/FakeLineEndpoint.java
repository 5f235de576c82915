package com.questrail.prt7.transport;

import java.util.Objects;

/**
 * FakeLineEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link LineEndpoint} implementation.
 *
 * <p>Contains no PRT-7 semantics; tests inject lines and lifecycle transitions
 * directly into the registered listener.</p>
 */
public final class FakeLineEndpoint implements LineEndpoint {

    private LineEndpointListener listener;
    private int starts;
    private int stops;

    @Override
    public void setListener(LineEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        starts++;
        requireListener().onTransportUp();
    }

    @Override
    public void stop() {
        stops++;
        requireListener().onTransportDown(null);
    }

    @Override
    public String describe() {
        return "fake://endpoint";
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectLine(String line) {
        requireListener().onLine(line);
    }

    public void injectDown(Throwable cause) {
        requireListener().onTransportDown(cause);
    }

    public int starts() {
        return starts;
    }

    public int stops() {
        return stops;
    }

    private LineEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
