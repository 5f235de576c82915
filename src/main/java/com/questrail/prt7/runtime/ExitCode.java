package com.questrail.prt7.runtime;

/**
 * Process exit codes returned by {@link Prt7DecoderMain}.
 */
public enum ExitCode {
    /** The stream was decoded and the message printed. */
    SUCCESS(0),
    /** The transport failed; a partial message may have been printed. */
    TRANSPORT_FAILURE(1),
    /** Command-line arguments were invalid. */
    INVALID_ARGS(2);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
