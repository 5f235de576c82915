package com.questrail.prt7.transport;

import java.util.Optional;

/**
 * LineSource
 * -----------------------------------------------------------------------------
 * Pull-style port through which the decoder loop obtains input lines.
 *
 * <p>Implementations own line buffering and terminator detection. Every line
 * they return is complete and has its {@code \n} / {@code \r\n} removed.</p>
 *
 * <p>Implementations may block for a bounded time inside {@link #nextLine()};
 * the decoder core never sleeps on its own.</p>
 */
public interface LineSource extends AutoCloseable
{
    /**
     * Returns the next complete line, if one is available.
     *
     * @return the line without terminator characters, or {@link Optional#empty()}
     *         when no complete line is currently available or the stream has ended
     * @throws TransportFailureException on an unrecoverable read fault
     */
    Optional<String> nextLine();

    /**
     * Indicates that the stream has ended and no buffered line remains.
     *
     * <p>Once this returns {@code true}, {@link #nextLine()} will never produce
     * another line.</p>
     */
    boolean isExhausted();

    /**
     * Release the underlying transport. Idempotent.
     */
    @Override
    void close();
}
