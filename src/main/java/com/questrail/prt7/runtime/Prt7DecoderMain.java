package com.questrail.prt7.runtime;

import com.questrail.prt7.config.Prt7RuntimeConfig;
import com.questrail.prt7.config.SourceKind;
import com.questrail.prt7.internal.exec.DecodeResult;
import com.questrail.prt7.internal.exec.Prt7PollingPolicy;
import com.questrail.prt7.observability.Slf4jPrt7ObservabilitySink;
import com.questrail.prt7.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command-line entry point for the PRT-7 decoder.
 *
 * <p>The hidden message is printed to standard output on a single line; all
 * progress goes through SLF4J.</p>
 */
public final class Prt7DecoderMain {
    private static final Logger log = LoggerFactory.getLogger(Prt7DecoderMain.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
        "source", "file", "host", "port", "pollTimeoutMs", "maxEmptyPolls", "maxLineLength", "verbose");

    static final String USAGE = """
        usage: prt7-decoder [source=stdin|file|tcp] [file=<path>] [host=<host>] [port=<port>]
                            [pollTimeoutMs=<ms>] [maxEmptyPolls=<n>] [maxLineLength=<n>] [verbose=true|false]

        Reads PRT-7 frames (L,<c> | L,Space | M,<signed-int> | END), one per line,
        and prints the decoded message.""";

    private Prt7DecoderMain() {}

    public static void main(String[] args) {
        ExitCode exit = run(args, System.in, System.out, System.err);
        System.exit(exit.code());
    }

    /**
     * Runs the decoder without terminating the JVM.
     */
    static ExitCode run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        final Prt7RuntimeConfig config;
        try {
            config = parseConfig(CliArgsParser.toMap(args));
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return ExitCode.INVALID_ARGS;
        }

        AtomicReference<DecodeResult> finished = new AtomicReference<>();
        Prt7DecoderRuntime runtime = Prt7DecoderRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jPrt7ObservabilitySink(config.verbose()))
            .withStdin(in)
            .withFinishedCallback(finished::set)
            .build();

        log.info("--- PRT-7 decoder started (source={}) ---", config.source());
        try {
            DecodeResult result = runtime.decode();
            out.println(result.message());
            return ExitCode.SUCCESS;
        } catch (TransportFailureException e) {
            DecodeResult partial = finished.get();
            if (partial != null) {
                out.println(partial.message());
            }
            err.println("error: " + e.getMessage());
            return ExitCode.TRANSPORT_FAILURE;
        } finally {
            log.info("--- PRT-7 decoder stopped ---");
        }
    }

    static Prt7RuntimeConfig parseConfig(Map<String, String> args) {
        for (String key : args.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("unknown argument: " + key);
            }
        }

        Prt7PollingPolicy defaults = Prt7PollingPolicy.defaults();
        Prt7PollingPolicy polling = new Prt7PollingPolicy(
            Duration.ofMillis(CliArgsParser.intValue(args, "pollTimeoutMs", (int) defaults.pollTimeout().toMillis())),
            CliArgsParser.intValue(args, "maxEmptyPolls", defaults.maxConsecutiveEmptyPolls())
        );

        Prt7RuntimeConfig.Builder builder = Prt7RuntimeConfig.builder()
            .withSource(SourceKind.parse(args.getOrDefault("source", "stdin")))
            .withHost(args.get("host"))
            .withPort(CliArgsParser.intValue(args, "port", 0))
            .withPollingPolicy(polling)
            .withMaxLineLength(CliArgsParser.intValue(args, "maxLineLength", Prt7RuntimeConfig.DEFAULT_MAX_LINE_LENGTH))
            .withVerbose(CliArgsParser.booleanValue(args, "verbose", false));
        if (args.containsKey("file")) {
            builder.withFile(Path.of(args.get("file")));
        }
        return builder.build();
    }
}
