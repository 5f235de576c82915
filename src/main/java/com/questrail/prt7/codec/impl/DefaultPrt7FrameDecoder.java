package com.questrail.prt7.codec.impl;

import com.questrail.prt7.codec.MalformedFrameException;
import com.questrail.prt7.codec.Prt7FrameDecoder;
import com.questrail.prt7.model.DataFrame;
import com.questrail.prt7.model.Prt7Frame;
import com.questrail.prt7.model.RemapFrame;
import com.questrail.prt7.model.TerminateFrame;

/**
 * DefaultPrt7FrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link Prt7FrameDecoder}.
 *
 * <p>Classification is by the first two characters of the line:</p>
 * <ul>
 *   <li>{@code L,} DATA. The payload {@code Space} (case-sensitive) carries a
 *       space; otherwise the payload must be exactly one character.</li>
 *   <li>{@code M,} REMAP. The payload is parsed by {@link Prt7Integers}.</li>
 *   <li>A line exactly equal to {@code END} terminates.</li>
 * </ul>
 *
 * <p>Everything else, including the empty line, is malformed.</p>
 */
public final class DefaultPrt7FrameDecoder implements Prt7FrameDecoder
{
    static final String DATA_PREFIX = "L,";
    static final String REMAP_PREFIX = "M,";
    static final String TERMINATE_LINE = "END";

    @Override
    public Prt7Frame decode(String line)
    {
        if (line == null || line.isEmpty()) {
            throw new MalformedFrameException(line, "empty line");
        }

        if (line.startsWith(DATA_PREFIX)) {
            return decodeData(line);
        }
        if (line.startsWith(REMAP_PREFIX)) {
            return decodeRemap(line);
        }
        if (TERMINATE_LINE.equals(line)) {
            return TerminateFrame.INSTANCE;
        }

        throw new MalformedFrameException(line, "unrecognized frame prefix");
    }

    private static DataFrame decodeData(String line)
    {
        final int payloadStart = DATA_PREFIX.length();
        final int payloadLength = line.length() - payloadStart;

        if (payloadLength == 0) {
            throw new MalformedFrameException(line, "DATA frame without payload");
        }
        if (line.regionMatches(payloadStart, DataFrame.SPACE_LITERAL, 0, DataFrame.SPACE_LITERAL.length())
                && payloadLength == DataFrame.SPACE_LITERAL.length()) {
            return new DataFrame(' ');
        }
        if (payloadLength != 1) {
            throw new MalformedFrameException(line, "DATA payload must be a single character or 'Space'");
        }

        return new DataFrame(line.charAt(payloadStart));
    }

    private static RemapFrame decodeRemap(String line)
    {
        try {
            return new RemapFrame(Prt7Integers.parseSignedDecimal(line, REMAP_PREFIX.length()));
        }
        catch (NumberFormatException e) {
            throw new MalformedFrameException(line, "invalid REMAP argument: " + e.getMessage(), e);
        }
    }
}
