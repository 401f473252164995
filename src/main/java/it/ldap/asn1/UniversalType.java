package it.ldap.asn1;

/**
 * Universal class tag numbers. Codes 14 and 15 are unassigned and 31 is the
 * high-tag-number escape, so none of them is a universal type.
 */
public enum UniversalType {
    EOC(0),
    BOOLEAN(1),
    INTEGER(2),
    BIT_STRING(3),
    OCTET_STRING(4),
    NULL(5),
    OBJECT_IDENTIFIER(6),
    OBJECT_DESCRIPTOR(7),
    EXTERNAL(8),
    REAL(9),
    ENUMERATED(10),
    EMBEDDED_PDV(11),
    UTF8_STRING(12),
    RELATIVE_OID(13),
    SEQUENCE(16),
    SET(17),
    NUMERIC_STRING(18),
    PRINTABLE_STRING(19),
    T61_STRING(20),
    VIDEOTEX_STRING(21),
    IA5_STRING(22),
    UTC_TIME(23),
    GENERALIZED_TIME(24),
    GRAPHIC_STRING(25),
    VISIBLE_STRING(26),
    GENERAL_STRING(27),
    UNIVERSAL_STRING(28),
    CHARACTER_STRING(29),
    BMP_STRING(30);

    private static final UniversalType[] BY_CODE = new UniversalType[31];

    static {
        for (UniversalType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;

    UniversalType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static UniversalType fromCode(long code) {
        UniversalType type = code >= 0 && code < BY_CODE.length ? BY_CODE[(int) code] : null;
        if (type == null) {
            throw new InvalidAsn1Exception(InvalidAsn1Exception.Reason.UNKNOWN_UNIVERSAL_TYPE,
                "Unknown ASN.1 universal type code: " + code);
        }
        return type;
    }
}
