package it.ldap.protocol;

import java.util.List;

import it.ldap.asn1.Asn1Class;
import it.ldap.asn1.Tag;

/**
 * An LDAPMessage envelope: message identifier, one protocol operation and optional controls.
 */
public record LdapMessage(long messageId, Tag operation, List<Tag> controls) {

    public LdapMessage {
        if (operation == null) {
            throw new IllegalArgumentException("LDAP message requires an operation");
        }
        controls = controls == null ? List.of() : List.copyOf(controls);
    }

    public LdapMessage(long messageId, Tag operation) {
        this(messageId, operation, List.of());
    }

    public boolean isOperation(int applicationNumber) {
        return operation.tagClass().asn1Class() == Asn1Class.APPLICATION
            && operation.tagClass().number() == applicationNumber;
    }

    public String operationName() {
        if (operation.tagClass().asn1Class() != Asn1Class.APPLICATION) {
            return operation.tagClass().toString();
        }
        return LdapTagMap.operationName(operation.tagClass().number());
    }
}
