package com.questrail.prt7.model;

/**
 * Canonical semantic representation of one PRT-7 instruction frame.
 *
 * <h2>Purpose</h2>
 * <p>
 * A {@code Prt7Frame} is the result of classifying exactly one input line.
 * It is created by the codec layer, consumed immediately by the frame
 * interpreter and never retained.
 * </p>
 *
 * <p>
 * The set of frame kinds is fixed by the wire format and therefore closed:
 * </p>
 * <ul>
 *   <li>{@link DataFrame} ({@code L,<c>} / {@code L,Space})</li>
 *   <li>{@link RemapFrame} ({@code M,<signed-int>})</li>
 *   <li>{@link TerminateFrame} ({@code END})</li>
 * </ul>
 *
 * <p>
 * Wire mechanics (prefixes, the {@code Space} literal, integer syntax) are
 * resolved <em>before</em> a frame exists; consumers dispatch on the concrete
 * type only.
 * </p>
 */
public sealed interface Prt7Frame
        permits DataFrame, RemapFrame, TerminateFrame {

    /**
     * Returns the canonical wire form of this frame, without a line terminator.
     *
     * <p>Used for progress reporting and diagnostics only.</p>
     */
    String wireForm();
}
