package it.ldap.asn1;

import java.nio.ByteBuffer;

/**
 * Serializes tag trees to BER, depth first.
 */
public final class BerEncoder {

    private BerEncoder() {
    }

    public static byte[] encode(Tag tag) {
        tag = tag.canonical();
        if (tag.size() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("ASN.1 tag of " + tag.size() + " octets does not fit in a byte array");
        }
        ByteBuffer out = ByteBuffer.allocate((int) tag.size());
        write(tag, out);
        if (out.hasRemaining()) {
            throw new IllegalStateException("Encoded " + out.position() + " octets for a tag of size " + tag.size());
        }
        return out.array();
    }

    /**
     * Writes the tag at the buffer's position in minimal form. The buffer needs
     * {@code tag.canonical().size()} octets remaining.
     */
    public static void encodeTo(Tag tag, ByteBuffer out) {
        write(tag.canonical(), out);
    }

    private static void write(Tag tag, ByteBuffer out) {
        int start = out.position();
        writeType(out, tag.type());
        writeLength(out, tag.length());
        Payload payload = tag.payload();
        if (payload.isConstructed()) {
            for (Tag child : payload.children()) {
                write(child, out);
            }
        } else {
            payload.copyOctetsTo(out);
        }
        int written = out.position() - start;
        if (written != tag.size()) {
            throw new IllegalStateException("Encoded " + written + " octets for a tag of size " + tag.size());
        }
    }

    static void writeType(ByteBuffer out, TagType type) {
        TagClass tagClass = type.tagClass();
        int firstOctet = (tagClass.asn1Class().bits() << 6) | (type.structure().bit() << 5);
        long number = tagClass.number();
        if (tagClass.isUniversal() || number <= BerLengths.LOW_TAG_NUMBER_MAX) {
            out.put((byte) (firstOctet | (int) number));
            return;
        }

        out.put((byte) (firstOctet | 0x1F));
        for (int group = BerLengths.base128Groups(number) - 1; group >= 0; group--) {
            int octet = (int) ((number >>> (7 * group)) & 0x7F);
            if (group != 0) {
                octet |= 0x80;
            }
            out.put((byte) octet);
        }
    }

    static void writeLength(ByteBuffer out, long length) {
        if (length <= BerLengths.SHORT_FORM_LENGTH_MAX) {
            out.put((byte) length);
            return;
        }

        int octets = BerLengths.minimalOctets(length);
        out.put((byte) (0x80 | octets));
        for (int i = octets - 1; i >= 0; i--) {
            out.put((byte) (length >>> (8 * i)));
        }
    }
}
