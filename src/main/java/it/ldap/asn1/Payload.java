package it.ldap.asn1;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Content of a tag: raw octets for primitive tags, child tags for constructed ones.
 */
public final class Payload {

    private final byte[] octets;
    private final List<Tag> children;

    private Payload(byte[] octets, List<Tag> children) {
        this.octets = octets;
        this.children = children;
    }

    public static Payload primitive(byte[] octets) {
        if (octets == null) {
            throw new IllegalArgumentException("Primitive payload requires octets");
        }
        return new Payload(octets.clone(), null);
    }

    public static Payload constructed(List<Tag> children) {
        if (children == null) {
            throw new IllegalArgumentException("Constructed payload requires children");
        }
        return new Payload(null, List.copyOf(children));
    }

    public static Payload constructed(Tag... children) {
        return constructed(List.of(children));
    }

    public Structure structure() {
        return children == null ? Structure.PRIMITIVE : Structure.CONSTRUCTED;
    }

    public boolean isConstructed() {
        return children != null;
    }

    /**
     * Payload length as written in the length field. For constructed payloads this
     * is the sum of the children's full encoded sizes.
     */
    public long length() {
        if (children == null) {
            return octets.length;
        }
        long length = 0;
        for (Tag child : children) {
            length = Math.addExact(length, child.size());
        }
        return length;
    }

    public byte[] octets() {
        if (octets == null) {
            throw new IllegalStateException("Constructed payload has no raw octets");
        }
        return octets.clone();
    }

    public List<Tag> children() {
        if (children == null) {
            throw new IllegalStateException("Primitive payload has no children");
        }
        return children;
    }

    void copyOctetsTo(ByteBuffer out) {
        out.put(octets);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Payload that)) {
            return false;
        }
        return Arrays.equals(octets, that.octets) && Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return children == null ? Arrays.hashCode(octets) : children.hashCode();
    }

    @Override
    public String toString() {
        return children == null ? HexFormat.of().formatHex(octets) : children.toString();
    }
}
