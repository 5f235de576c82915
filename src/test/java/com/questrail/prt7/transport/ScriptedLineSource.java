package com.questrail.prt7.transport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * ScriptedLineSource
 * -----------------------------------------------------------------------------
 * Test-only {@link LineSource} that replays a fixed script of steps.
 *
 * <p>Each step is a line, an idle poll, or a transport failure. When the script
 * runs out the source either reports exhaustion or keeps idling forever.</p>
 */
public final class ScriptedLineSource implements LineSource {

    private sealed interface Step permits Line, Idle, Failure {}
    private record Line(String text) implements Step {}
    private record Idle() implements Step {}
    private record Failure(String message) implements Step {}

    private final Deque<Step> steps = new ArrayDeque<>();
    private boolean exhaustWhenDrained = true;
    private int polls;
    private boolean closed;

    public static ScriptedLineSource of(String... lines) {
        ScriptedLineSource source = new ScriptedLineSource();
        for (String line : lines) {
            source.line(line);
        }
        return source;
    }

    public ScriptedLineSource line(String text) {
        steps.add(new Line(text));
        return this;
    }

    public ScriptedLineSource idle(int count) {
        for (int i = 0; i < count; i++) {
            steps.add(new Idle());
        }
        return this;
    }

    public ScriptedLineSource failWith(String message) {
        steps.add(new Failure(message));
        return this;
    }

    /**
     * After the script is drained, keep returning "no line yet" instead of exhausting.
     */
    public ScriptedLineSource idleForever() {
        this.exhaustWhenDrained = false;
        return this;
    }

    @Override
    public Optional<String> nextLine() {
        polls++;
        Step step = steps.poll();
        if (step instanceof Line line) {
            return Optional.of(line.text());
        }
        if (step instanceof Failure failure) {
            throw new TransportFailureException(failure.message());
        }
        return Optional.empty();
    }

    @Override
    public boolean isExhausted() {
        return exhaustWhenDrained && steps.isEmpty();
    }

    @Override
    public void close() {
        closed = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public int polls() {
        return polls;
    }

    public int remaining() {
        return steps.size();
    }

    public boolean isClosed() {
        return closed;
    }
}
