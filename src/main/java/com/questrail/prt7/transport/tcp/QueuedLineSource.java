package com.questrail.prt7.transport.tcp;

import com.questrail.prt7.internal.time.WallClock;
import com.questrail.prt7.observability.Prt7ObservabilitySink;
import com.questrail.prt7.observability.Prt7TransportEvent;
import com.questrail.prt7.transport.LineEndpoint;
import com.questrail.prt7.transport.LineEndpointListener;
import com.questrail.prt7.transport.LineSource;
import com.questrail.prt7.transport.TransportFailureException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * QueuedLineSource
 * =============================================================================
 * Adapter from a push-style {@link LineEndpoint} to the pull-style
 * {@link LineSource} the decoder loop consumes.
 *
 * <h2>Threading</h2>
 * <pre>
 *   endpoint event loop  → onLine(...)   → queue
 *   decoder thread       → nextLine()    ← queue.poll(pollTimeout)
 * </pre>
 *
 * <p>The queue is the only state shared between the two threads.</p>
 *
 * <h2>End of stream</h2>
 * Lines already queued when the transport goes down are still delivered.
 * Only after the queue drains does the source report exhaustion, or rethrow
 * the transport's failure cause as a {@link TransportFailureException}.
 * A failure that arrives before {@link #close()} is not rethrown once the
 * source is closed; the closed source reports exhaustion instead.
 */
public final class QueuedLineSource implements LineSource, LineEndpointListener
{
    private final LineEndpoint endpoint;
    private final Duration pollTimeout;
    private final Prt7ObservabilitySink observabilitySink;
    private final WallClock clock;

    private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();

    private volatile boolean down;
    private volatile Throwable failure;
    private volatile boolean closed;

    public QueuedLineSource(LineEndpoint endpoint,
                            Duration pollTimeout,
                            Prt7ObservabilitySink observabilitySink,
                            WallClock clock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.endpoint.setListener(this);
    }

    public void start()
    {
        endpoint.start();
    }

    // -------------------------------------------------------------------------
    // LineSource
    // -------------------------------------------------------------------------

    @Override
    public Optional<String> nextLine()
    {
        String line = lines.poll();
        if (line != null) {
            return Optional.of(line);
        }

        if (down) {
            // a line may have been queued just before the down signal
            line = lines.poll();
            if (line != null) {
                return Optional.of(line);
            }
            Throwable cause = failure;
            if (cause != null && !closed) {
                throw new TransportFailureException("transport failed: " + endpoint.describe(), cause);
            }
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(lines.poll(pollTimeout.toNanos(), TimeUnit.NANOSECONDS));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException("interrupted while waiting for a line", e);
        }
    }

    @Override
    public boolean isExhausted()
    {
        return down && lines.isEmpty() && (failure == null || closed);
    }

    @Override
    public void close()
    {
        if (!closed) {
            closed = true;
            endpoint.stop();
        }
    }

    // -------------------------------------------------------------------------
    // LineEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        observabilitySink.onTransportEvent(
                new Prt7TransportEvent(clock.now(), Prt7TransportEvent.Kind.UP, endpoint.describe()));
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        if (down) {
            return;
        }
        if (cause != null && !closed) {
            failure = cause;
            observabilitySink.onTransportEvent(
                    new Prt7TransportEvent(clock.now(), Prt7TransportEvent.Kind.FAILED,
                            endpoint.describe() + ": " + cause.getMessage()));
        }
        else {
            observabilitySink.onTransportEvent(
                    new Prt7TransportEvent(clock.now(), Prt7TransportEvent.Kind.DOWN, endpoint.describe()));
        }
        down = true;
    }

    @Override
    public void onLine(String line)
    {
        Objects.requireNonNull(line, "line");
        if (!closed) {
            lines.add(line);
        }
    }
}
