package com.questrail.prt7.model;

/**
 * Terminal frame ({@code END}).
 *
 * <p>
 * Stops the decoder without contributing a symbol. Stateless, so a single
 * shared instance is used.
 * </p>
 */
public enum TerminateFrame implements Prt7Frame
{
    INSTANCE;

    @Override
    public String wireForm() {
        return "END";
    }
}
