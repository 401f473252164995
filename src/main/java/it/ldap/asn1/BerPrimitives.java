package it.ldap.asn1;

import java.nio.charset.StandardCharsets;

import it.ldap.asn1.InvalidAsn1Exception.Reason;

/**
 * Contents octets of the universal primitives LDAP messages are built from.
 */
public final class BerPrimitives {

    private static final byte[] EMPTY = new byte[0];

    private BerPrimitives() {
    }

    public static Tag integer(long value) {
        return Tag.primitive(TagClass.universal(UniversalType.INTEGER), encodeInteger(value));
    }

    public static Tag enumerated(long value) {
        return Tag.primitive(TagClass.universal(UniversalType.ENUMERATED), encodeInteger(value));
    }

    public static Tag bool(boolean value) {
        return Tag.primitive(TagClass.universal(UniversalType.BOOLEAN), encodeBoolean(value));
    }

    public static Tag octetString(byte[] value) {
        return Tag.primitive(TagClass.universal(UniversalType.OCTET_STRING), value);
    }

    public static Tag octetString(String value) {
        return octetString(value == null ? EMPTY : value.getBytes(StandardCharsets.UTF_8));
    }

    public static Tag nullValue() {
        return Tag.primitive(TagClass.universal(UniversalType.NULL), EMPTY);
    }

    /**
     * Minimal two's complement, big-endian.
     */
    public static byte[] encodeInteger(long value) {
        int octets = 8;
        while (octets > 1) {
            long top = value >> (8 * (octets - 1) - 1);
            if (top != 0 && top != -1) {
                break;
            }
            octets--;
        }
        byte[] out = new byte[octets];
        for (int i = 0; i < octets; i++) {
            out[i] = (byte) (value >> (8 * (octets - 1 - i)));
        }
        return out;
    }

    public static long decodeInteger(byte[] octets) {
        if (octets.length == 0 || octets.length > 8) {
            throw new InvalidAsn1Exception(Reason.INVALID_INTEGER,
                "BER INTEGER must have 1 to 8 content octets, got " + octets.length);
        }
        long value = octets[0];
        for (int i = 1; i < octets.length; i++) {
            value = (value << 8) | (octets[i] & 0xFF);
        }
        return value;
    }

    public static byte[] encodeBoolean(boolean value) {
        return new byte[] {(byte) (value ? 0xFF : 0x00)};
    }

    public static boolean decodeBoolean(byte[] octets) {
        if (octets.length != 1) {
            throw new InvalidAsn1Exception(Reason.INVALID_BOOLEAN,
                "BER BOOLEAN must have exactly one content octet, got " + octets.length);
        }
        return octets[0] != 0;
    }

    public static long integerValue(Tag tag) {
        return decodeInteger(tag.octets());
    }

    public static boolean booleanValue(Tag tag) {
        return decodeBoolean(tag.octets());
    }

    public static String stringValue(Tag tag) {
        return new String(tag.octets(), StandardCharsets.UTF_8);
    }
}
