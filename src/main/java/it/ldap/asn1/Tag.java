package it.ldap.asn1;

import java.util.ArrayList;
import java.util.List;

/**
 * One BER TLV. {@code length} is the value of the length field and {@code size}
 * the full number of octets the tag occupies on the wire.
 */
public record Tag(TagType type, long length, Payload payload, long size) {

    public Tag {
        if (type == null || payload == null) {
            throw new IllegalArgumentException("Tag type and payload are required");
        }
        if (type.structure() != payload.structure()) {
            throw new IllegalArgumentException("Tag structure " + type.structure()
                + " does not match payload " + payload.structure());
        }
        if (length != payload.length()) {
            throw new IllegalArgumentException("ASN.1 length " + length + " does not match payload length " + payload.length());
        }
        long minimal = BerLengths.tagSize(type, length);
        if (size < minimal) {
            throw new IllegalArgumentException("ASN.1 tag size " + size + " is below the encoded minimum " + minimal);
        }
    }

    public static Tag of(TagClass tagClass, Payload payload) {
        TagType type = new TagType(tagClass, payload.structure());
        long length = payload.length();
        return new Tag(type, length, payload, BerLengths.tagSize(type, length));
    }

    public static Tag primitive(TagClass tagClass, byte[] octets) {
        return of(tagClass, Payload.primitive(octets));
    }

    public static Tag constructed(TagClass tagClass, List<Tag> children) {
        return of(tagClass, Payload.constructed(children));
    }

    public static Tag constructed(TagClass tagClass, Tag... children) {
        return of(tagClass, Payload.constructed(children));
    }

    public TagClass tagClass() {
        return type.tagClass();
    }

    public boolean constructed() {
        return type.constructed();
    }

    public boolean is(TagClass expected) {
        return type.tagClass().equals(expected);
    }

    public byte[] octets() {
        return payload.octets();
    }

    public List<Tag> children() {
        return payload.children();
    }

    /**
     * True when the tag occupies exactly as many octets as its minimal encoding.
     */
    public boolean minimallyEncoded() {
        return size == BerLengths.tagSize(type, length);
    }

    /**
     * Returns this tag with every header in minimal form. Decoded tags may carry
     * long-form lengths padded with leading zeros.
     */
    public Tag canonical() {
        if (!payload.isConstructed()) {
            return minimallyEncoded() ? this : of(tagClass(), payload);
        }
        List<Tag> children = payload.children();
        List<Tag> rebuilt = new ArrayList<>(children.size());
        boolean changed = false;
        for (Tag child : children) {
            Tag canonicalChild = child.canonical();
            changed |= canonicalChild != child;
            rebuilt.add(canonicalChild);
        }
        if (!changed && minimallyEncoded()) {
            return this;
        }
        return constructed(tagClass(), rebuilt);
    }
}
