package com.questrail.prt7.internal.exec;

/**
 * Outcome of interpreting one line.
 */
public enum ContinueSignal
{
    /** The frame was dispatched; keep reading. */
    CONTINUE,

    /** The line was malformed and skipped; keep reading. */
    SKIPPED,

    /** A terminal frame was received. */
    STOP;

    public boolean shouldContinue() {
        return this != STOP;
    }
}
