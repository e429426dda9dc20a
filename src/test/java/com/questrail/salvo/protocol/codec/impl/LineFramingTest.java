package com.questrail.salvo.protocol.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class LineFramingTest {

    @Test
    void frameAppendsTheDelimiter() {
        assertEquals("{}\n", LineFraming.frame("{}"));
    }

    @Test
    void frameRefusesEmbeddedDelimiter() {
        assertThrows(IllegalArgumentException.class, () -> LineFraming.frame("a\nb"));
    }

    @Test
    void unframeStripsLfAndCrLf() {
        assertEquals("{}", LineFraming.unframe("{}\n"));
        assertEquals("{}", LineFraming.unframe("{}\r\n"));
        assertEquals("{}", LineFraming.unframe("{}\r"));
        assertEquals("{}", LineFraming.unframe("{}"));
        assertEquals("", LineFraming.unframe("\n"));
    }
}
