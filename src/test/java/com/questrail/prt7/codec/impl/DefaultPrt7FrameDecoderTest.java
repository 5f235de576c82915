package com.questrail.prt7.codec.impl;

import com.questrail.prt7.codec.MalformedFrameException;
import com.questrail.prt7.model.DataFrame;
import com.questrail.prt7.model.Prt7Frame;
import com.questrail.prt7.model.RemapFrame;
import com.questrail.prt7.model.TerminateFrame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultPrt7FrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultPrt7FrameDecoder}.
 *
 * <p>Only line classification and payload extraction are exercised here; no
 * rotor or buffer is involved.</p>
 */
final class DefaultPrt7FrameDecoderTest
{
    private final DefaultPrt7FrameDecoder decoder = new DefaultPrt7FrameDecoder();

    @Test
    void decodeDataFrameCarriesPayloadCharacter()
    {
        Prt7Frame frame = decoder.decode("L,H");

        assertEquals(new DataFrame('H'), frame);
    }

    @Test
    void decodeDataFrameKeepsCaseAndPunctuation()
    {
        assertEquals(new DataFrame('h'), decoder.decode("L,h"));
        assertEquals(new DataFrame('7'), decoder.decode("L,7"));
        assertEquals(new DataFrame(','), decoder.decode("L,,"));
    }

    @Test
    void decodeSpaceLiteral()
    {
        assertEquals(new DataFrame(' '), decoder.decode("L,Space"));
    }

    @Test
    void spaceLiteralIsCaseSensitive()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode("L,space"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("L,SPACE"));
    }

    @Test
    void decodeRemapFrames()
    {
        assertEquals(new RemapFrame(2), decoder.decode("M,2"));
        assertEquals(new RemapFrame(-2), decoder.decode("M,-2"));
        assertEquals(new RemapFrame(0), decoder.decode("M,0"));
        assertEquals(new RemapFrame(105), decoder.decode("M,105"));
    }

    @Test
    void decodeTerminateFrame()
    {
        assertSame(TerminateFrame.INSTANCE, decoder.decode("END"));
    }

    @Test
    void terminateMustMatchExactly()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode("END "));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("end"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("ENDX"));
    }

    @Test
    void rejectUnrecognizedPrefix()
    {
        MalformedFrameException e = assertThrows(MalformedFrameException.class, () -> decoder.decode("X,?"));
        assertEquals("X,?", e.line());
    }

    @Test
    void rejectEmptyAndNullLines()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode(""));
        assertThrows(MalformedFrameException.class, () -> decoder.decode(null));
    }

    @Test
    void rejectDataFrameWithoutPayload()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode("L,"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("L"));
    }

    @Test
    void rejectOversizedDataPayload()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode("L,AB"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("L,Spaces"));
    }

    @Test
    void rejectNonNumericRemapArgument()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode("M,"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("M,-"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("M,abc"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("M,+3"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("M, 3"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("M,3x"));
    }

    @Test
    void rejectOutOfRangeRemapArgument()
    {
        MalformedFrameException e = assertThrows(MalformedFrameException.class,
                () -> decoder.decode("M,99999999999"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void prefixesAreCaseSensitive()
    {
        assertThrows(MalformedFrameException.class, () -> decoder.decode("l,A"));
        assertThrows(MalformedFrameException.class, () -> decoder.decode("m,2"));
    }
}
