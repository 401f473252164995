package it.ldap.protocol;

import java.util.List;

import it.ldap.asn1.Asn1Class;
import it.ldap.asn1.BerPrimitives;
import it.ldap.asn1.InvalidAsn1Exception;
import it.ldap.asn1.InvalidAsn1Exception.Reason;
import it.ldap.asn1.Tag;
import it.ldap.asn1.TagClass;
import it.ldap.asn1.UniversalType;

/**
 * The LDAPResult components shared by every response operation.
 */
public record LdapResult(int resultCode, String matchedDn, String diagnosticMessage) {

    public static final int SUCCESS = 0;

    public boolean success() {
        return resultCode == SUCCESS;
    }

    public static LdapResult from(Tag response) {
        if (response.tagClass().asn1Class() != Asn1Class.APPLICATION || !response.constructed()) {
            throw new InvalidAsn1Exception(Reason.INVALID_ENVELOPE,
                "LDAP response must be a constructed APPLICATION tag, got " + response.tagClass());
        }
        List<Tag> fields = response.children();
        if (fields.size() < 3) {
            throw new InvalidAsn1Exception(Reason.INVALID_ENVELOPE,
                "LDAP result needs resultCode, matchedDN and diagnosticMessage, got " + fields.size() + " fields");
        }
        Tag code = expect(fields.get(0), UniversalType.ENUMERATED, "resultCode");
        Tag matchedDn = expect(fields.get(1), UniversalType.OCTET_STRING, "matchedDN");
        Tag diagnostic = expect(fields.get(2), UniversalType.OCTET_STRING, "diagnosticMessage");
        long resultCode = BerPrimitives.integerValue(code);
        if (resultCode < 0 || resultCode > Integer.MAX_VALUE) {
            throw new InvalidAsn1Exception(Reason.INVALID_ENVELOPE, "LDAP resultCode " + resultCode + " is out of range");
        }
        return new LdapResult(
            (int) resultCode,
            BerPrimitives.stringValue(matchedDn),
            BerPrimitives.stringValue(diagnostic)
        );
    }

    private static Tag expect(Tag field, UniversalType type, String name) {
        if (!field.is(TagClass.universal(type)) || field.constructed()) {
            throw new InvalidAsn1Exception(Reason.INVALID_ENVELOPE,
                "LDAP result " + name + " must be " + type + ", got " + field.tagClass());
        }
        return field;
    }
}
