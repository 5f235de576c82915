package com.questrail.prt7.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class Prt7FrameTest
{
    @Test
    void wireFormMatchesLineSyntax()
    {
        assertEquals("L,A", new DataFrame('A').wireForm());
        assertEquals("L,Space", new DataFrame(' ').wireForm());
        assertEquals("M,-2", new RemapFrame(-2).wireForm());
        assertEquals("END", TerminateFrame.INSTANCE.wireForm());
    }
}
