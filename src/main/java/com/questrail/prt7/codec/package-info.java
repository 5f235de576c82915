/**
 * PRT-7 Codec: Line-Level Decoding
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the PRT-7 frame
 * protocol. One frame travels per ASCII line:</p>
 *
 * <pre>
 *   L,&lt;c&gt;           DATA frame carrying character &lt;c&gt;
 *   L,Space         DATA frame carrying a space
 *   M,&lt;signed-int&gt;  REMAP frame with rotation delta
 *   END             terminate stream
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   transport line (terminator stripped)
 *        → Prt7FrameDecoder      (wire rules applied here)
 *            → Prt7Frame         (DataFrame | RemapFrame | TerminateFrame)
 *                → FrameInterpreter
 *                    → SubstitutionRotor / AssemblyBuffer
 * </pre>
 *
 * <p>Decoding failures surface as {@link com.questrail.prt7.codec.MalformedFrameException}
 * and never affect rotor or buffer state.</p>
 */
package com.questrail.prt7.codec;
