package com.questrail.prt7.config;

import com.questrail.prt7.internal.exec.Prt7PollingPolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Aggregated configuration for one decoder run.
 *
 * <p>{@code file} is required for {@link SourceKind#FILE}; {@code host} and
 * {@code port} for {@link SourceKind#TCP}. Unused fields may be {@code null} or
 * zero.</p>
 */
public record Prt7RuntimeConfig(
    SourceKind source,
    Path file,
    String host,
    int port,
    Prt7PollingPolicy pollingPolicy,
    int maxLineLength,
    boolean verbose
) {
    public static final int DEFAULT_MAX_LINE_LENGTH = 64;

    public Prt7RuntimeConfig {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(pollingPolicy, "pollingPolicy");

        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive");
        }
        if (source == SourceKind.FILE && file == null) {
            throw new IllegalArgumentException("file is required for source=file");
        }
        if (source == SourceKind.TCP) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host is required for source=tcp");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be 1-65535 for source=tcp");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SourceKind source = SourceKind.STDIN;
        private Path file;
        private String host;
        private int port;
        private Prt7PollingPolicy pollingPolicy = Prt7PollingPolicy.defaults();
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private boolean verbose;

        public Builder withSource(SourceKind source) {
            this.source = source;
            return this;
        }

        public Builder withFile(Path file) {
            this.file = file;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withPollingPolicy(Prt7PollingPolicy pollingPolicy) {
            this.pollingPolicy = pollingPolicy;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder withVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Prt7RuntimeConfig build() {
            return new Prt7RuntimeConfig(source, file, host, port, pollingPolicy, maxLineLength, verbose);
        }
    }
}
