package com.questrail.prt7.transport;

/**
 * Signals an unrecoverable fault while reading from a transport.
 *
 * <p>Unlike a malformed line, a transport failure ends the decoder run.</p>
 */
public final class TransportFailureException extends RuntimeException
{
    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
