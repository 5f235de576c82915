package com.questrail.prt7.config;

import java.util.Locale;

/**
 * Where the decoder reads its PRT-7 lines from.
 */
public enum SourceKind
{
    /** Standard input, one frame per line. */
    STDIN,

    /** A recorded capture file. */
    FILE,

    /** A TCP line feed such as a serial-to-TCP bridge. */
    TCP;

    /**
     * Case-insensitive lookup by name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SourceKind parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("source must be one of stdin, file, tcp (was '" + value + "')", e);
        }
    }
}
