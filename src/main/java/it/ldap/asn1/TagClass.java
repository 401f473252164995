package it.ldap.asn1;

/**
 * Class of a tag together with its tag number. Universal numbers are always one
 * of the {@link UniversalType} codes.
 */
public record TagClass(Asn1Class asn1Class, long number) {

    public TagClass {
        if (asn1Class == null) {
            throw new IllegalArgumentException("ASN.1 class is required");
        }
        if (number < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 tag number: " + number);
        }
        if (asn1Class == Asn1Class.UNIVERSAL) {
            UniversalType.fromCode(number);
        }
    }

    public static TagClass universal(UniversalType type) {
        return new TagClass(Asn1Class.UNIVERSAL, type.code());
    }

    public static TagClass application(long number) {
        return new TagClass(Asn1Class.APPLICATION, number);
    }

    public static TagClass contextSpecific(long number) {
        return new TagClass(Asn1Class.CONTEXT_SPECIFIC, number);
    }

    public static TagClass privateClass(long number) {
        return new TagClass(Asn1Class.PRIVATE, number);
    }

    /**
     * Builds a class from the two class bits of an identifier octet and a decoded tag number.
     */
    public static TagClass construct(int classBits, long number) {
        Asn1Class asn1Class = Asn1Class.fromBits(classBits);
        return switch (asn1Class) {
            case UNIVERSAL -> universal(UniversalType.fromCode(number));
            case APPLICATION, CONTEXT_SPECIFIC, PRIVATE -> new TagClass(asn1Class, number);
        };
    }

    public boolean isUniversal() {
        return asn1Class == Asn1Class.UNIVERSAL;
    }

    public boolean isUniversal(UniversalType type) {
        return isUniversal() && number == type.code();
    }

    public UniversalType universalType() {
        if (!isUniversal()) {
            throw new IllegalStateException("Not a universal tag: " + this);
        }
        return UniversalType.fromCode(number);
    }

    @Override
    public String toString() {
        return switch (asn1Class) {
            case UNIVERSAL -> "UNIVERSAL " + universalType();
            case APPLICATION -> "[APPLICATION " + number + "]";
            case CONTEXT_SPECIFIC -> "[" + number + "]";
            case PRIVATE -> "[PRIVATE " + number + "]";
        };
    }
}
