package com.questrail.prt7.model;

/**
 * REMAP frame.
 *
 * <p>
 * Carries a signed rotation amount applied to the rotor. Only DATA frames
 * processed <em>after</em> this frame observe the new shift.
 * </p>
 *
 * <p>
 * Any magnitude is legal; whole revolutions are reduced by the rotor.
 * </p>
 */
public record RemapFrame(int delta) implements Prt7Frame
{
    @Override
    public String wireForm() {
        return "M," + delta;
    }
}
