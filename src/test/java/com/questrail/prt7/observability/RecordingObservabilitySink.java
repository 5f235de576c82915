package com.questrail.prt7.observability;

import com.questrail.prt7.internal.exec.DecodeResult;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements Prt7ObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onFrameProcessed(FrameProcessedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(Prt7ErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(Prt7TransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onFinished(DecodeResult result) {
        events.add(result);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<FrameProcessedEvent> getFrameEvents() {
        return ofType(FrameProcessedEvent.class);
    }

    public synchronized List<Prt7ErrorEvent> getErrors() {
        return ofType(Prt7ErrorEvent.class);
    }

    public synchronized List<Prt7TransportEvent> getTransportEvents() {
        return ofType(Prt7TransportEvent.class);
    }

    public synchronized List<DecodeResult> getFinished() {
        return ofType(DecodeResult.class);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
