package it.ldap.asn1;

/**
 * Raised when bytes or values do not form valid BER for this codec.
 */
public class InvalidAsn1Exception extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        INVALID_CLASS,
        UNKNOWN_UNIVERSAL_TYPE,
        TAG_NUMBER_OVERFLOW,
        INDEFINITE_LENGTH,
        LENGTH_OVERFLOW,
        TRUNCATED,
        CHILD_OVERRUN,
        NESTING_TOO_DEEP,
        TRAILING_DATA,
        INVALID_INTEGER,
        INVALID_BOOLEAN,
        INVALID_ENVELOPE,
        MESSAGE_TOO_LARGE
    }

    private final Reason reason;

    public InvalidAsn1Exception(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
