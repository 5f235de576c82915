package com.questrail.prt7.transport;

/**
 * LineEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link LineEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation (Netty endpoints serialize callbacks on the channel's event
 * loop).</p>
 */
public interface LineEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause an exception or diagnostic cause; {@code null} for an orderly
     *              end of stream
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for each complete line received, terminator removed.
     *
     * @param line one line of text
     */
    void onLine(String line);
}
