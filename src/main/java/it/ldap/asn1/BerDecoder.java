package it.ldap.asn1;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import it.ldap.asn1.InvalidAsn1Exception.Reason;

/**
 * Parses BER octets into tag trees. Input is treated as untrusted: every
 * malformed or truncated structure ends in an {@link InvalidAsn1Exception}.
 */
public final class BerDecoder {

    static final int MAX_DEPTH = 64;

    private BerDecoder() {
    }

    /**
     * Decodes the first tag of the buffer. Trailing octets are left untouched and
     * reported through {@link DecodeResult#consumed()}.
     */
    public static DecodeResult decode(byte[] buffer) {
        return decodeAt(buffer, 0, buffer.length);
    }

    public static DecodeResult decodeAt(byte[] buffer, int offset, int limit) {
        checkBounds(buffer, offset, limit);
        return decodeAt(buffer, offset, limit, 0);
    }

    public static List<Tag> decodeAll(byte[] buffer) {
        List<Tag> result = new ArrayList<>();
        int offset = 0;
        while (offset < buffer.length) {
            DecodeResult decoded = decodeAt(buffer, offset, buffer.length, 0);
            result.add(decoded.tag());
            offset += decoded.consumed();
        }
        return result;
    }

    public static Tag decodeSingle(byte[] buffer) {
        DecodeResult decoded = decode(buffer);
        if (decoded.consumed() != buffer.length) {
            throw new InvalidAsn1Exception(Reason.TRAILING_DATA,
                "Trailing data after ASN.1 BER TLV: " + (buffer.length - decoded.consumed()) + " octets");
        }
        return decoded.tag();
    }

    /**
     * Size of the TLV starting at {@code offset}, computed from its identifier and
     * length octets only, or -1 when those octets are not all available yet.
     */
    public static int frameLength(byte[] buffer, int offset, int limit) {
        checkBounds(buffer, offset, limit);
        Header header = readHeader(buffer, offset, limit);
        if (header == null) {
            return -1;
        }
        long total = (long) header.headerLength() + header.length();
        if (total > Integer.MAX_VALUE) {
            throw new InvalidAsn1Exception(Reason.LENGTH_OVERFLOW, "BER frame of " + total + " octets is too large");
        }
        return (int) total;
    }

    private static DecodeResult decodeAt(byte[] buffer, int offset, int limit, int depth) {
        Reason shortOfBytes = depth == 0 ? Reason.TRUNCATED : Reason.CHILD_OVERRUN;
        Header header = readHeader(buffer, offset, limit);
        if (header == null) {
            throw new InvalidAsn1Exception(shortOfBytes, offset >= limit
                ? "Missing ASN.1 BER tag"
                : "Incomplete ASN.1 BER identifier or length octets");
        }

        int valueStart = offset + header.headerLength();
        long end = (long) valueStart + header.length();
        if (end > limit) {
            throw new InvalidAsn1Exception(shortOfBytes, "BER value length " + header.length()
                + " exceeds the " + (limit - valueStart) + " available octets");
        }
        int valueEnd = (int) end;

        Payload payload;
        if (header.type().constructed()) {
            if (depth >= MAX_DEPTH) {
                throw new InvalidAsn1Exception(Reason.NESTING_TOO_DEEP, "BER nesting exceeds " + MAX_DEPTH + " levels");
            }
            List<Tag> children = new ArrayList<>();
            int position = valueStart;
            while (position < valueEnd) {
                DecodeResult child = decodeAt(buffer, position, valueEnd, depth + 1);
                children.add(child.tag());
                position += child.consumed();
            }
            payload = Payload.constructed(children);
        } else {
            payload = Payload.primitive(Arrays.copyOfRange(buffer, valueStart, valueEnd));
        }

        int consumed = valueEnd - offset;
        return new DecodeResult(new Tag(header.type(), header.length(), payload, consumed), consumed);
    }

    private static Header readHeader(byte[] buffer, int offset, int limit) {
        int index = offset;
        if (index >= limit) {
            return null;
        }

        int firstTagOctet = buffer[index++] & 0xFF;
        int classBits = (firstTagOctet >> 6) & 0x03;
        Structure structure = Structure.fromBit((firstTagOctet >> 5) & 0x01);
        long tagNumber = firstTagOctet & 0x1F;
        if (tagNumber == 0x1F) {
            tagNumber = 0;
            while (true) {
                if (index >= limit) {
                    return null;
                }
                int octet = buffer[index++] & 0xFF;
                if (tagNumber > (Long.MAX_VALUE >>> 7)) {
                    throw new InvalidAsn1Exception(Reason.TAG_NUMBER_OVERFLOW, "BER tag number does not fit in 63 bits");
                }
                tagNumber = (tagNumber << 7) | (octet & 0x7F);
                if ((octet & 0x80) == 0) {
                    break;
                }
            }
        }
        TagType type = new TagType(TagClass.construct(classBits, tagNumber), structure);

        if (index >= limit) {
            return null;
        }
        int firstLengthOctet = buffer[index++] & 0xFF;
        long length;
        if ((firstLengthOctet & 0x80) == 0) {
            length = firstLengthOctet;
        } else {
            int numberOfLengthOctets = firstLengthOctet & 0x7F;
            if (numberOfLengthOctets == 0) {
                throw new InvalidAsn1Exception(Reason.INDEFINITE_LENGTH, "Indefinite BER length is not supported");
            }
            if (numberOfLengthOctets == 0x7F) {
                throw new InvalidAsn1Exception(Reason.LENGTH_OVERFLOW, "Reserved BER length octet 0xFF");
            }
            length = 0;
            for (int i = 0; i < numberOfLengthOctets; i++) {
                if (index >= limit) {
                    return null;
                }
                if (length > (Integer.MAX_VALUE >>> 8)) {
                    throw new InvalidAsn1Exception(Reason.LENGTH_OVERFLOW, "BER length too large");
                }
                length = (length << 8) | (buffer[index++] & 0xFF);
            }
        }

        return new Header(type, length, index - offset);
    }

    private static void checkBounds(byte[] buffer, int offset, int limit) {
        if (buffer == null) {
            throw new IllegalArgumentException("Buffer is required");
        }
        if (offset < 0 || limit > buffer.length || offset > limit) {
            throw new IndexOutOfBoundsException("Range [" + offset + ", " + limit + ") outside buffer of " + buffer.length);
        }
    }

    public record DecodeResult(Tag tag, int consumed) {
    }

    private record Header(TagType type, long length, int headerLength) {
    }
}
