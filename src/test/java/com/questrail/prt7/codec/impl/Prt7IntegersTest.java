package com.questrail.prt7.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class Prt7IntegersTest
{
    @Test
    void parsesFromOffset()
    {
        assertEquals(42, Prt7Integers.parseSignedDecimal("M,42", 2));
        assertEquals(-7, Prt7Integers.parseSignedDecimal("M,-7", 2));
    }

    @Test
    void leadingZerosAreAccepted()
    {
        assertEquals(5, Prt7Integers.parseSignedDecimal("005", 0));
        assertEquals(0, Prt7Integers.parseSignedDecimal("-0", 0));
    }

    @Test
    void intBoundariesAreAccepted()
    {
        assertEquals(Integer.MAX_VALUE, Prt7Integers.parseSignedDecimal("2147483647", 0));
        assertEquals(Integer.MIN_VALUE, Prt7Integers.parseSignedDecimal("-2147483648", 0));
    }

    @Test
    void valuesBeyondIntRangeAreRejected()
    {
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("2147483648", 0));
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("-2147483649", 0));
    }

    @Test
    void malformedInputIsRejected()
    {
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("", 0));
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("-", 0));
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("--1", 0));
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("1-", 0));
        assertThrows(NumberFormatException.class, () -> Prt7Integers.parseSignedDecimal("٣", 0));
    }
}
