package com.largomodo.badgelayout.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnitConverterTest {

    @Test
    void testMillimetresTruncateToPixels() {
        assertEquals(803, UnitConverter.mmToPixels(68, 300));
        assertEquals(59, UnitConverter.mmToPixels(5, 300));
        assertEquals(11, UnitConverter.mmToPixels(1, 300));
        assertEquals(377, UnitConverter.mmToPixels(32, 300));
    }

    @Test
    void testDefaultDpi() {
        assertEquals(300, UnitConverter.DEFAULT_DPI);
        assertEquals(UnitConverter.mmToPixels(42, 300), UnitConverter.mmToPixels(42));
    }

    @Test
    void testZeroLength() {
        assertEquals(0, UnitConverter.mmToPixels(0, 300));
    }

    @Test
    void testPixelsToMillimetres() {
        assertEquals(25.4, UnitConverter.pixelsToMm(300, 300), 1e-9);
        assertEquals(50.8, UnitConverter.pixelsToMm(300, 150), 1e-9);
    }

    @Test
    void testNonPositiveDpiThrows() {
        assertThrows(IllegalArgumentException.class, () -> UnitConverter.mmToPixels(10, 0));
        assertThrows(IllegalArgumentException.class, () -> UnitConverter.pixelsToMm(10, -300));
    }
}
