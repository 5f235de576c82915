package com.questrail.prt7.core;

/**
 * SubstitutionRotor
 * -----------------------------------------------------------------------------
 * Rotating alphabetic substitution wheel (Caesar-style) keyed by a mutable shift.
 *
 * <h2>Model</h2>
 * The rotor holds the 26 letters {@code A..Z} in fixed cyclic order plus one
 * integer {@code shift}. The ring itself never changes; only the shift does.
 * A letter at alphabet position {@code i} maps to the ring entry at
 * {@code (i + shift) mod 26}.
 *
 * <pre>
 *   shift = 0 :  A -> A, W -> W
 *   shift = 2 :  A -> C, W -> Y, Z -> B
 * </pre>
 *
 * <h2>Shift tracking</h2>
 * The shift is held as an integer and applied arithmetically. It is never
 * derived from the distance between a moving head and the ring cells.
 *
 * <h2>Laws</h2>
 * <ul>
 *   <li>Rotations summing to a multiple of 26 leave {@link #map(char)} unchanged</li>
 *   <li>{@code rotate(n)} followed by {@code rotate(-n)} restores the mapping</li>
 *   <li>Non-letters pass through unchanged for every shift</li>
 * </ul>
 *
 * <h2>Output case</h2>
 * Letters are matched case-insensitively and always emitted in upper case.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. A rotor is owned by exactly one decoder loop.
 */
public final class SubstitutionRotor
{
    public static final int ALPHABET_SIZE = 26;

    private static final char[] RING = buildRing();

    private int shift;

    /**
     * Creates a rotor in its initial position (shift 0, identity mapping).
     */
    public SubstitutionRotor() {
        this.shift = 0;
    }

    /**
     * Rotates the wheel by {@code delta} positions.
     *
     * <p>Any {@code int} is accepted, including negative values and multiple
     * full revolutions. Runs in constant time.</p>
     *
     * @param delta signed rotation amount
     */
    public void rotate(int delta) {
        // reduce first so shift + residue cannot overflow
        shift = Math.floorMod(shift + (delta % ALPHABET_SIZE), ALPHABET_SIZE);
    }

    /**
     * Translates one symbol using the current shift.
     *
     * @param symbol raw symbol
     * @return the shifted upper-case letter, or {@code symbol} itself when it is
     *         not one of the 26 ASCII letters
     */
    public char map(char symbol) {
        int index = alphabetIndex(symbol);
        if (index < 0) {
            return symbol;
        }
        return RING[(index + shift) % ALPHABET_SIZE];
    }

    /**
     * Returns the current effective shift, always in {@code [0, 26)}.
     */
    public int shift() {
        return shift;
    }

    /**
     * Short human-readable summary of the rotor position, e.g. {@code shift=2 (A->C)}.
     */
    public String describe() {
        return "shift=" + shift + " (A->" + map('A') + ")";
    }

    @Override
    public String toString() {
        return "SubstitutionRotor[" + describe() + ']';
    }

    private static int alphabetIndex(char symbol) {
        if (symbol >= 'A' && symbol <= 'Z') {
            return symbol - 'A';
        }
        if (symbol >= 'a' && symbol <= 'z') {
            return symbol - 'a';
        }
        return -1;
    }

    private static char[] buildRing() {
        char[] ring = new char[ALPHABET_SIZE];
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            ring[i] = (char) ('A' + i);
        }
        return ring;
    }
}
