package com.questrail.prt7.internal.exec;

import com.questrail.prt7.codec.impl.DefaultPrt7FrameDecoder;
import com.questrail.prt7.internal.time.FixedWallClock;
import com.questrail.prt7.observability.RecordingObservabilitySink;
import com.questrail.prt7.transport.ScriptedLineSource;
import com.questrail.prt7.transport.TransportFailureException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DecoderLoopTest
 * -----------------------------------------------------------------------------
 * Drives the loop with scripted sources and checks every stop path.
 */
class DecoderLoopTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FixedWallClock clock = new FixedWallClock();

    private DecoderLoop loopOver(ScriptedLineSource source, int maxEmptyPolls) {
        FrameInterpreter interpreter = new FrameInterpreter(new DefaultPrt7FrameDecoder(), sink, clock);
        return new DecoderLoop(source, interpreter,
                new Prt7PollingPolicy(Duration.ZERO, maxEmptyPolls), sink, clock);
    }

    @Test
    void documentedScenarioDecodesHiddenMessage() {
        ScriptedLineSource source = ScriptedLineSource.of(
                "L,H", "L,O", "L,L",
                "M,2",
                "L,A", "L,Space", "L,W",
                "M,-2",
                "L,O", "L,R", "L,L", "L,D",
                "END");
        DecoderLoop loop = loopOver(source, 3);

        DecodeResult result = loop.run();

        assertEquals("HOLC YORLD", result.message());
        assertEquals(StopReason.TERMINATED, result.stopReason());
        assertEquals(13, result.framesProcessed());
        assertEquals(0, result.malformedFrames());
        assertEquals(0, result.finalShift());
        assertEquals(DecoderState.STOPPED, loop.state());
    }

    @Test
    void remapAffectsOnlyLaterFrames() {
        DecoderLoop loop = loopOver(ScriptedLineSource.of("L,A", "L,B", "M,1", "L,A", "M,1", "L,A", "END"), 3);

        assertEquals("ABBC", loop.run().message());
    }

    @Test
    void endStopsBeforeReadingFurtherLines() {
        ScriptedLineSource source = ScriptedLineSource.of("L,A", "END", "L,B", "L,C");
        DecoderLoop loop = loopOver(source, 3);

        DecodeResult result = loop.run();

        assertEquals("A", result.message());
        assertEquals(2, source.remaining());
    }

    @Test
    void malformedLinesAreSkippedAndCounted() {
        ScriptedLineSource source = ScriptedLineSource.of("L,H", "X,?", "M,abc", "L,", "L,I", "END");

        DecodeResult result = loopOver(source, 3).run();

        assertEquals("HI", result.message());
        assertEquals(3, result.malformedFrames());
        assertEquals(3, result.framesProcessed());
        assertEquals(3, sink.getErrors().size());
    }

    @Test
    void exhaustedSourceEndsNormally() {
        DecodeResult result = loopOver(ScriptedLineSource.of("M,3", "L,X"), 3).run();

        assertEquals("A", result.message());
        assertEquals(StopReason.END_OF_STREAM, result.stopReason());
        assertTrue(result.stopReason().isNormal());
        assertEquals(3, result.finalShift());
    }

    @Test
    void emptySourceRendersEmptyMessage() {
        DecodeResult result = loopOver(ScriptedLineSource.of(), 3).run();

        assertEquals("", result.message());
        assertEquals(StopReason.END_OF_STREAM, result.stopReason());
    }

    @Test
    void idleLimitStopsAfterConsecutiveEmptyPolls() {
        ScriptedLineSource source = ScriptedLineSource.of("L,O", "L,K").idleForever();

        DecodeResult result = loopOver(source, 4).run();

        assertEquals("OK", result.message());
        assertEquals(StopReason.IDLE_LIMIT, result.stopReason());
        assertEquals(2 + 4, source.polls());
    }

    @Test
    void receivedLineResetsIdleCount() {
        ScriptedLineSource source = new ScriptedLineSource()
                .idle(2).line("L,A")
                .idle(2).line("L,B")
                .line("END");

        DecodeResult result = loopOver(source, 3).run();

        assertEquals("AB", result.message());
        assertEquals(StopReason.TERMINATED, result.stopReason());
    }

    @Test
    void transportFailureRendersPartialMessageAndRethrows() {
        ScriptedLineSource source = ScriptedLineSource.of("L,P", "L,A")
                .failWith("serial link lost")
                .line("L,Z");
        DecoderLoop loop = loopOver(source, 3);

        TransportFailureException e = assertThrows(TransportFailureException.class, loop::run);

        assertEquals("serial link lost", e.getMessage());
        assertEquals(DecoderState.STOPPED, loop.state());
        assertEquals("PA", loop.currentMessage());

        assertEquals(1, sink.getFinished().size());
        DecodeResult partial = sink.getFinished().get(0);
        assertEquals("PA", partial.message());
        assertEquals(StopReason.TRANSPORT_FAILURE, partial.stopReason());
        assertFalse(partial.stopReason().isNormal());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void finishedIsReportedExactlyOnce() {
        loopOver(ScriptedLineSource.of("L,A", "END"), 3).run();

        assertEquals(1, sink.getFinished().size());
        assertEquals("A", sink.getFinished().get(0).message());
    }

    @Test
    void loopRunsOnlyOnce() {
        DecoderLoop loop = loopOver(ScriptedLineSource.of("END"), 3);
        loop.run();

        assertThrows(IllegalStateException.class, loop::run);
    }
}
