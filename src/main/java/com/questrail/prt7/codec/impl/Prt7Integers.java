package com.questrail.prt7.codec.impl;

/**
 * Prt7Integers
 * -----------------------------------------------------------------------------
 * Manual decimal parsing for REMAP arguments.
 *
 * <p>Accepted syntax is {@code -?[0-9]+}: an optional leading minus sign followed
 * by at least one ASCII digit. A leading {@code +}, whitespace, or any other
 * character is rejected. Locale-aware parsing is deliberately not used.</p>
 *
 * <p>Values outside the {@code int} range are rejected rather than wrapped.</p>
 */
final class Prt7Integers
{
    private Prt7Integers() {}

    /**
     * Parses {@code text[from..]} as a signed decimal integer.
     *
     * @throws NumberFormatException if the text is empty, malformed or out of range
     */
    static int parseSignedDecimal(String text, int from)
    {
        final int length = text.length();
        int pos = from;

        boolean negative = false;
        if (pos < length && text.charAt(pos) == '-') {
            negative = true;
            pos++;
        }

        if (pos >= length) {
            throw new NumberFormatException("missing digits");
        }

        // Accumulate as a negative value so Integer.MIN_VALUE is representable.
        final int limit = negative ? Integer.MIN_VALUE : -Integer.MAX_VALUE;
        final int multiplyMin = limit / 10;

        int result = 0;
        for (; pos < length; pos++) {
            char c = text.charAt(pos);
            if (c < '0' || c > '9') {
                throw new NumberFormatException("non-digit character '" + c + "'");
            }
            int digit = c - '0';

            if (result < multiplyMin) {
                throw new NumberFormatException("value out of range");
            }
            result *= 10;
            if (result < limit + digit) {
                throw new NumberFormatException("value out of range");
            }
            result -= digit;
        }

        return negative ? result : -result;
    }
}
