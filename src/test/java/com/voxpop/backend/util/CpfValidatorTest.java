package com.voxpop.backend.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CpfValidatorTest {

    @Test
    void testIsValid_FormattedAndBare() {
        assertTrue(CpfValidator.isValid("529.982.247-25"));
        assertTrue(CpfValidator.isValid("52998224725"));
        assertTrue(CpfValidator.isValid("111.444.777-35"));
    }

    @Test
    void testIsValid_WrongCheckDigits() {
        assertFalse(CpfValidator.isValid("529.982.247-24"));
        assertFalse(CpfValidator.isValid("529.982.247-15"));
    }

    @Test
    void testIsValid_RepeatedDigitsRejected() {
        assertFalse(CpfValidator.isValid("000.000.000-00"));
        assertFalse(CpfValidator.isValid("11111111111"));
    }

    @Test
    void testIsValid_WrongLength() {
        assertFalse(CpfValidator.isValid("5299822472"));
        assertFalse(CpfValidator.isValid(""));
        assertFalse(CpfValidator.isValid(null));
    }

    @Test
    void testClean() {
        assertEquals("52998224725", CpfValidator.clean("529.982.247-25"));
        assertEquals("", CpfValidator.clean(null));
    }
}
