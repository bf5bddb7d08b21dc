package work.cinit.trace.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CLiteralsTest {
    @Test
    void parsesIntegerSpellings() {
        assertEquals(255L, CLiterals.parseNumber("0xff"));
        assertEquals(8L, CLiterals.parseNumber("010"));
        assertEquals(42L, CLiterals.parseNumber("42UL"));
        assertEquals(0L, CLiterals.parseNumber("0"));
        assertEquals(5L, CLiterals.parseNumber("0b101"));
    }

    @Test
    void unsignedSuffixAllowsTheFullRange() {
        assertEquals(-1L, CLiterals.parseNumber("18446744073709551615UL"));
        assertEquals(Long.MIN_VALUE, CLiterals.parseNumber("9223372036854775808u"));
        assertEquals(-1L, CLiterals.parseNumber("01777777777777777777777U"));
    }

    @Test
    void rejectsOutOfRangeIntegers() {
        assertThrows(NumberFormatException.class, () -> CLiterals.parseNumber("9223372036854775808"));
        assertThrows(NumberFormatException.class, () -> CLiterals.parseNumber("18446744073709551616u"));
    }

    @Test
    void parsesFloatingSpellings() {
        assertEquals(1.5, CLiterals.parseNumber("1.5f"));
        assertEquals(1000.0, CLiterals.parseNumber("1e3"));
        assertEquals(0.125, CLiterals.parseNumber("0x1p-3"));
        assertEquals(3.0, CLiterals.parseNumber("0x1.8p1f"));
    }

    @Test
    void decodesEscapes() {
        assertEquals("a\"b\n", CLiterals.decodeString("\"a\\\"b\\n\""));
        assertEquals(10L, CLiterals.decodeChar("'\\n'"));
        assertEquals(65L, CLiterals.decodeChar("'A'"));
        assertEquals("A", CLiterals.decodeString("\"\\x41\""));
        assertThrows(IllegalArgumentException.class, () -> CLiterals.decodeString("\"\\xzz\""));
    }

    @Test
    void measuresTextInUtf8Bytes() {
        assertEquals(2, CLiterals.bytes("\u00e9").length);
        assertEquals(3, CLiterals.bytes("abc").length);
    }

    @Test
    void quotesForListings() {
        assertEquals("\"tab\\there\"", CLiterals.quote("tab\there"));
    }

    @Test
    void trimsCommentDelimitersAndDedents() {
        assertEquals("Upper bound.", CLiterals.trimComment("/* Upper bound.  */"));
        assertEquals("First line.\nSecond line.", CLiterals.trimComment("/* First line.\n     Second line.  */"));
        assertEquals("note", CLiterals.trimComment("// note"));
    }

    @Test
    void numbersListingLines() {
        assertEquals(String.format("   1: a%n   2: b%n"), Listings.numbered(java.util.List.of("a", "b")));
    }
}
