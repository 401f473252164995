package it.ldap.asn1;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HexFormat;

import org.junit.jupiter.api.Test;

class BerPrimitivesTest {

    private static final HexFormat HEX = HexFormat.of();

    @Test
    void shouldEncodeMinimalTwosComplement() {
        assertArrayEquals(HEX.parseHex("00"), BerPrimitives.encodeInteger(0));
        assertArrayEquals(HEX.parseHex("7f"), BerPrimitives.encodeInteger(127));
        assertArrayEquals(HEX.parseHex("0080"), BerPrimitives.encodeInteger(128));
        assertArrayEquals(HEX.parseHex("ff"), BerPrimitives.encodeInteger(-1));
        assertArrayEquals(HEX.parseHex("80"), BerPrimitives.encodeInteger(-128));
        assertArrayEquals(HEX.parseHex("ff7f"), BerPrimitives.encodeInteger(-129));
        assertArrayEquals(HEX.parseHex("7fffffff"), BerPrimitives.encodeInteger(Integer.MAX_VALUE));
        assertArrayEquals(HEX.parseHex("8000000000000000"), BerPrimitives.encodeInteger(Long.MIN_VALUE));
    }

    @Test
    void shouldDecodeSignedIntegers() {
        for (long value : new long[] {0, 1, -1, 255, 256, -32_768, Integer.MAX_VALUE, Long.MAX_VALUE, Long.MIN_VALUE}) {
            assertEquals(value, BerPrimitives.decodeInteger(BerPrimitives.encodeInteger(value)));
        }
        assertEquals(255, BerPrimitives.decodeInteger(HEX.parseHex("00ff")));
    }

    @Test
    void shouldRejectEmptyOrOversizedInteger() {
        assertEquals(InvalidAsn1Exception.Reason.INVALID_INTEGER, assertThrows(InvalidAsn1Exception.class,
            () -> BerPrimitives.decodeInteger(new byte[0])).reason());
        assertThrows(InvalidAsn1Exception.class, () -> BerPrimitives.decodeInteger(new byte[9]));
    }

    @Test
    void shouldHandleBooleans() {
        assertArrayEquals(HEX.parseHex("ff"), BerPrimitives.encodeBoolean(true));
        assertArrayEquals(HEX.parseHex("00"), BerPrimitives.encodeBoolean(false));
        assertTrue(BerPrimitives.decodeBoolean(HEX.parseHex("01")));
        assertFalse(BerPrimitives.decodeBoolean(HEX.parseHex("00")));
        assertEquals(InvalidAsn1Exception.Reason.INVALID_BOOLEAN, assertThrows(InvalidAsn1Exception.class,
            () -> BerPrimitives.decodeBoolean(HEX.parseHex("0101"))).reason());
    }

    @Test
    void shouldBuildUniversalTags() {
        assertArrayEquals(HEX.parseHex("0a0107"), BerEncoder.encode(BerPrimitives.enumerated(7)));
        assertArrayEquals(HEX.parseHex("0500"), BerEncoder.encode(BerPrimitives.nullValue()));
        assertArrayEquals(HEX.parseHex("0400"), BerEncoder.encode(BerPrimitives.octetString((String) null)));
        assertEquals("dc=example", BerPrimitives.stringValue(BerPrimitives.octetString("dc=example")));
    }
}
