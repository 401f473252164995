package it.ldap.asn1;

/**
 * Size arithmetic shared by the encoder and the decoder.
 */
public final class BerLengths {

    static final int LOW_TAG_NUMBER_MAX = 30;
    static final int SHORT_FORM_LENGTH_MAX = 127;

    private BerLengths() {
    }

    /**
     * Total encoded size of a tag: identifier octets, length octets and payload.
     */
    public static long tagSize(TagType type, long payloadLength) {
        if (payloadLength < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 length: " + payloadLength);
        }
        return typeOctets(type.tagClass()) + lengthOctets(payloadLength) + payloadLength;
    }

    public static int typeOctets(TagClass tagClass) {
        return switch (tagClass.asn1Class()) {
            case UNIVERSAL -> 1;
            case APPLICATION, CONTEXT_SPECIFIC, PRIVATE -> highTagNumberOctets(tagClass.number());
        };
    }

    public static int lengthOctets(long length) {
        if (length <= SHORT_FORM_LENGTH_MAX) {
            return 1;
        }
        return 1 + minimalOctets(length);
    }

    /**
     * Number of octets in the minimal big-endian form of a non-negative value.
     */
    static int minimalOctets(long value) {
        int octets = 0;
        long remaining = value;
        do {
            octets++;
            remaining >>>= 8;
        } while (remaining > 0);
        return octets;
    }

    static int base128Groups(long number) {
        int groups = 0;
        long remaining = number;
        do {
            groups++;
            remaining >>>= 7;
        } while (remaining > 0);
        return groups;
    }

    private static int highTagNumberOctets(long number) {
        if (number <= LOW_TAG_NUMBER_MAX) {
            return 1;
        }
        return 1 + base128Groups(number);
    }
}
