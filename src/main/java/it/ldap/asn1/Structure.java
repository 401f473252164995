package it.ldap.asn1;

public enum Structure {
    PRIMITIVE(0),
    CONSTRUCTED(1);

    private final int bit;

    Structure(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public static Structure fromBit(int bit) {
        return switch (bit) {
            case 0 -> PRIMITIVE;
            case 1 -> CONSTRUCTED;
            default -> throw new IllegalArgumentException("Structure bit must be 0 or 1, got " + bit);
        };
    }
}
