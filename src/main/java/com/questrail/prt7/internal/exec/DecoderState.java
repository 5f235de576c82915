package com.questrail.prt7.internal.exec;

/**
 * Lifecycle of a {@link DecoderLoop}. The only transition is RUNNING to STOPPED.
 */
public enum DecoderState
{
    RUNNING,
    STOPPED
}
