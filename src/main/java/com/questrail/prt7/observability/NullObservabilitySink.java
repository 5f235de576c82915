package com.questrail.prt7.observability;

import com.questrail.prt7.internal.exec.DecodeResult;

/**
 * No-op implementation of Prt7ObservabilitySink.
 */
public final class NullObservabilitySink implements Prt7ObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrameProcessed(FrameProcessedEvent event) {}

    @Override
    public void onError(Prt7ErrorEvent event) {}

    @Override
    public void onTransportEvent(Prt7TransportEvent event) {}

    @Override
    public void onFinished(DecodeResult result) {}
}
