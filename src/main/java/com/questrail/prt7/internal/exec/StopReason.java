package com.questrail.prt7.internal.exec;

/**
 * Why a {@link DecoderLoop} reached {@link DecoderState#STOPPED}.
 */
public enum StopReason
{
    /** An {@code END} frame was received. */
    TERMINATED,

    /** The transport reported that the stream has ended. */
    END_OF_STREAM,

    /** Too many consecutive polls returned no line. */
    IDLE_LIMIT,

    /** The transport failed; the message may be incomplete. */
    TRANSPORT_FAILURE;

    /**
     * Whether this is a normal termination (anything but a transport failure).
     */
    public boolean isNormal() {
        return this != TRANSPORT_FAILURE;
    }
}
