package com.questrail.prt7.runtime;

import com.questrail.prt7.codec.Prt7FrameDecoder;
import com.questrail.prt7.codec.impl.DefaultPrt7FrameDecoder;
import com.questrail.prt7.config.Prt7RuntimeConfig;
import com.questrail.prt7.internal.exec.DecodeResult;
import com.questrail.prt7.internal.exec.DecoderLoop;
import com.questrail.prt7.internal.exec.FrameInterpreter;
import com.questrail.prt7.internal.time.SystemWallClock;
import com.questrail.prt7.internal.time.WallClock;
import com.questrail.prt7.observability.FrameProcessedEvent;
import com.questrail.prt7.observability.NullObservabilitySink;
import com.questrail.prt7.observability.Prt7ErrorEvent;
import com.questrail.prt7.observability.Prt7ObservabilitySink;
import com.questrail.prt7.observability.Prt7TransportEvent;
import com.questrail.prt7.transport.LineSource;
import com.questrail.prt7.transport.stream.ReaderLineSource;
import com.questrail.prt7.transport.tcp.QueuedLineSource;
import com.questrail.prt7.transport.tcp.netty.NettyTcpLineEndpoint;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Prt7DecoderRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one decoding run.
 *
 * <pre>
 *   LineSource (stdin | file | Netty TCP)
 *        → DecoderLoop
 *            → FrameInterpreter → DefaultPrt7FrameDecoder
 *                → SubstitutionRotor / AssemblyBuffer
 *        → Prt7ObservabilitySink.onFinished
 * </pre>
 *
 * <p>The line source is opened in {@link #decode()} and always closed before it
 * returns.</p>
 */
public final class Prt7DecoderRuntime {
    private final Prt7RuntimeConfig config;
    private final Prt7ObservabilitySink observabilitySink;
    private final WallClock clock;
    private final InputStream stdin;

    private Prt7DecoderRuntime(Prt7RuntimeConfig config,
                               Prt7ObservabilitySink observabilitySink,
                               WallClock clock,
                               InputStream stdin) {
        this.config = config;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
        this.stdin = stdin;
    }

    /**
     * Opens the configured source and decodes until the loop stops.
     *
     * @return final message and run statistics
     * @throws com.questrail.prt7.transport.TransportFailureException if the
     *         source cannot be opened or fails while reading
     */
    public DecodeResult decode() {
        Prt7FrameDecoder frameDecoder = new DefaultPrt7FrameDecoder();
        FrameInterpreter interpreter = new FrameInterpreter(frameDecoder, observabilitySink, clock);

        try (LineSource source = openSource()) {
            DecoderLoop loop = new DecoderLoop(
                source,
                interpreter,
                config.pollingPolicy(),
                observabilitySink,
                clock
            );
            return loop.run();
        }
    }

    public Prt7RuntimeConfig config() {
        return config;
    }

    private LineSource openSource() {
        switch (config.source()) {
            case STDIN:
                return ReaderLineSource.fromStream(stdin, "stdin");
            case FILE:
                return ReaderLineSource.fromFile(config.file());
            case TCP:
                NettyTcpLineEndpoint endpoint = new NettyTcpLineEndpoint(
                    new InetSocketAddress(config.host(), config.port()),
                    config.maxLineLength()
                );
                QueuedLineSource queued = new QueuedLineSource(
                    endpoint,
                    config.pollingPolicy().pollTimeout(),
                    observabilitySink,
                    clock
                );
                queued.start();
                return queued;
            default:
                throw new IllegalStateException("Unsupported source: " + config.source());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Prt7RuntimeConfig config;
        private Prt7ObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private InputStream stdin = System.in;
        private Consumer<DecodeResult> finishedCallback;

        public Builder withConfig(Prt7RuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(Prt7ObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withStdin(InputStream stdin) {
            this.stdin = stdin;
            return this;
        }

        public Builder withFinishedCallback(Consumer<DecodeResult> callback) {
            this.finishedCallback = callback;
            return this;
        }

        public Prt7DecoderRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(stdin, "stdin");

            // Composite sink for finished callback + original sink
            Prt7ObservabilitySink effectiveSink = observabilitySink;
            if (finishedCallback != null) {
                final Prt7ObservabilitySink delegate = observabilitySink;
                final Consumer<DecodeResult> callback = finishedCallback;
                effectiveSink = new Prt7ObservabilitySink() {
                    @Override
                    public void onFinished(DecodeResult result) {
                        delegate.onFinished(result);
                        callback.accept(result);
                    }

                    @Override public void onFrameProcessed(FrameProcessedEvent event) { delegate.onFrameProcessed(event); }
                    @Override public void onError(Prt7ErrorEvent event) { delegate.onError(event); }
                    @Override public void onTransportEvent(Prt7TransportEvent event) { delegate.onTransportEvent(event); }
                };
            }

            return new Prt7DecoderRuntime(config, effectiveSink, clock, stdin);
        }
    }
}
