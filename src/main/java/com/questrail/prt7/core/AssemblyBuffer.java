package com.questrail.prt7.core;

/**
 * AssemblyBuffer
 * -----------------------------------------------------------------------------
 * Ordered, append-only accumulation of decoded symbols.
 *
 * <p>Insertion order is the arrival order of DATA frames. Symbols are never
 * removed or reordered. Any character is accepted, including space and
 * punctuation.</p>
 *
 * <p>Not thread-safe; owned by a single decoder loop.</p>
 */
public final class AssemblyBuffer
{
    private final StringBuilder symbols = new StringBuilder();

    /**
     * Appends one decoded symbol to the end of the sequence.
     */
    public void append(char symbol) {
        symbols.append(symbol);
    }

    /**
     * Returns the accumulated sequence in insertion order.
     *
     * <p>Does not mutate the buffer and may be called at any time; returns the
     * empty string before the first append.</p>
     */
    public String render() {
        return symbols.toString();
    }

    public int size() {
        return symbols.length();
    }

    public boolean isEmpty() {
        return symbols.length() == 0;
    }

    @Override
    public String toString() {
        return "AssemblyBuffer[size=" + symbols.length() + ']';
    }
}
