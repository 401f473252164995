package it.ldap.asn1;

public enum Asn1Class {
    UNIVERSAL(0),
    APPLICATION(1),
    CONTEXT_SPECIFIC(2),
    PRIVATE(3);

    private final int bits;

    Asn1Class(int bits) {
        this.bits = bits;
    }

    /**
     * Value of the two class bits at the top of the first identifier octet.
     */
    public int bits() {
        return bits;
    }

    public static Asn1Class fromBits(int bits) {
        return switch (bits) {
            case 0 -> UNIVERSAL;
            case 1 -> APPLICATION;
            case 2 -> CONTEXT_SPECIFIC;
            case 3 -> PRIVATE;
            default -> throw new InvalidAsn1Exception(InvalidAsn1Exception.Reason.INVALID_CLASS,
                "Invalid ASN.1 tag class: " + bits);
        };
    }
}
