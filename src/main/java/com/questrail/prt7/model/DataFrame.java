package com.questrail.prt7.model;

/**
 * DATA frame.
 *
 * <p>
 * Carries one raw symbol that is translated by the rotor and appended to the
 * assembly buffer. A literal space travels on the wire as {@code L,Space}.
 * </p>
 */
public record DataFrame(char symbol) implements Prt7Frame
{
    /**
     * Payload literal standing in for a space character.
     */
    public static final String SPACE_LITERAL = "Space";

    @Override
    public String wireForm() {
        return "L," + (symbol == ' ' ? SPACE_LITERAL : String.valueOf(symbol));
    }
}
