package com.questrail.prt7.codec;

import com.questrail.prt7.model.Prt7Frame;

/**
 * Prt7FrameDecoder
 * -----------------------------------------------------------------------------
 * Line-level decoder for PRT-7 frames.
 *
 * <p>This interface defines the inbound boundary between one line of text
 * delivered by a transport and a typed {@link Prt7Frame}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Recognising the frame prefix ({@code L,}, {@code M,}, {@code END})</li>
 *   <li>Validating and extracting the payload</li>
 *   <li>Constructing a {@link Prt7Frame} on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Translating symbols or touching the rotor</li>
 *   <li>Line buffering or terminator detection</li>
 *   <li>Reporting errors to a presentation layer</li>
 * </ul>
 */
public interface Prt7FrameDecoder
{
    /**
     * Decode a single line into a frame.
     *
     * <p>The line must already have its terminator characters removed. Each call
     * is independent; no state is carried between lines.</p>
     *
     * @param line one complete input line
     * @return the decoded frame, never {@code null}
     * @throws MalformedFrameException if the line is not a legal PRT-7 frame
     */
    Prt7Frame decode(String line);
}
