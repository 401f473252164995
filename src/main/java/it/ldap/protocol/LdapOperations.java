package it.ldap.protocol;

import java.nio.charset.StandardCharsets;

import it.ldap.asn1.BerPrimitives;
import it.ldap.asn1.Tag;
import it.ldap.asn1.TagClass;

/**
 * Builders for the requests the client issues itself.
 */
public final class LdapOperations {

    public static final int PROTOCOL_VERSION = 3;

    private LdapOperations() {
    }

    public static Tag simpleBind(String bindDn, String password) {
        byte[] credentials = password == null ? new byte[0] : password.getBytes(StandardCharsets.UTF_8);
        return Tag.constructed(
            TagClass.application(LdapTagMap.BIND_REQUEST),
            BerPrimitives.integer(PROTOCOL_VERSION),
            BerPrimitives.octetString(bindDn),
            Tag.primitive(TagClass.contextSpecific(LdapTagMap.BIND_AUTH_SIMPLE), credentials)
        );
    }

    public static Tag anonymousBind() {
        return simpleBind("", "");
    }

    public static Tag unbind() {
        return Tag.primitive(TagClass.application(LdapTagMap.UNBIND_REQUEST), new byte[0]);
    }
}
