package com.questrail.prt7.codec;

/**
 * Indicates that an input line could not be decoded into a PRT-7 frame.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown or missing frame prefix</li>
 *   <li>Empty or oversized DATA payload</li>
 *   <li>Non-numeric or out-of-range REMAP argument</li>
 * </ul>
 *
 * The condition is recoverable: the offending line is skipped.
 */
public final class MalformedFrameException extends RuntimeException
{
    private final String line;

    public MalformedFrameException(String line, String message) {
        super(message);
        this.line = line;
    }

    public MalformedFrameException(String line, String message, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * Returns the offending line as received; may be {@code null}.
     */
    public String line() {
        return line;
    }
}
