package com.participant.matching.zipcode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ZipCodesTest {

    @Test
    @DisplayName("Should accept numeric and text ZIP values")
    void acceptsZipValues() {
        assertEquals(OptionalInt.of(43065), ZipCodes.parse(43065));
        assertEquals(OptionalInt.of(43065), ZipCodes.parse(43065L));
        assertEquals(OptionalInt.of(43065), ZipCodes.parse(43065.0));
        assertEquals(OptionalInt.of(43065), ZipCodes.parse(new BigDecimal("43065")));
        assertEquals(OptionalInt.of(43065), ZipCodes.parse("43065"));
        assertEquals(OptionalInt.of(43065), ZipCodes.parse(" 43065-1234 "));
        assertEquals(OptionalInt.of(43065), ZipCodes.parse("43065.0"));
        assertEquals(OptionalInt.of(2134), ZipCodes.parse("02134"));
    }

    @Test
    @DisplayName("Should reject placeholders and junk")
    void rejectsJunk() {
        assertTrue(ZipCodes.parse(null).isEmpty());
        assertTrue(ZipCodes.parse(-1).isEmpty());
        assertTrue(ZipCodes.parse(-1.0).isEmpty());
        assertTrue(ZipCodes.parse("-1").isEmpty());
        assertTrue(ZipCodes.parse(Double.NaN).isEmpty());
        assertTrue(ZipCodes.parse("nan").isEmpty());
        assertTrue(ZipCodes.parse(0).isEmpty());
        assertTrue(ZipCodes.parse(43065.5).isEmpty());
        assertTrue(ZipCodes.parse("430650").isEmpty());
        assertTrue(ZipCodes.parse("unknown").isEmpty());
    }

    @Test
    @DisplayName("Should format as five zero-padded digits")
    void formats() {
        assertEquals("02134", ZipCodes.format(2134));
        assertEquals("43065", ZipCodes.format(43065));
    }

    @Test
    @DisplayName("Region should be inclusive and validated")
    void region() {
        assertTrue(ZipRegion.OHIO.contains(43000));
        assertTrue(ZipRegion.OHIO.contains(45999));
        assertFalse(ZipRegion.OHIO.contains(46000));
        assertFalse(ZipRegion.OHIO.contains(42999));
        assertThrows(IllegalArgumentException.class, () -> new ZipRegion(45000, 44000));
    }
}
