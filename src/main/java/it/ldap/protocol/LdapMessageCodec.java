package it.ldap.protocol;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import it.ldap.asn1.BerDecoder;
import it.ldap.asn1.BerEncoder;
import it.ldap.asn1.BerPrimitives;
import it.ldap.asn1.InvalidAsn1Exception;
import it.ldap.asn1.InvalidAsn1Exception.Reason;
import it.ldap.asn1.Structure;
import it.ldap.asn1.Tag;
import it.ldap.asn1.TagClass;
import it.ldap.asn1.UniversalType;

@Component
public class LdapMessageCodec {

    private static final TagClass SEQUENCE = TagClass.universal(UniversalType.SEQUENCE);
    private static final TagClass INTEGER = TagClass.universal(UniversalType.INTEGER);
    private static final TagClass CONTROLS = TagClass.contextSpecific(LdapTagMap.MESSAGE_CONTROLS);
    private static final long MAX_MESSAGE_ID = Integer.MAX_VALUE;

    public byte[] encode(Tag operation, long messageId) {
        return BerEncoder.encode(envelope(operation, messageId, List.of()));
    }

    public byte[] encode(LdapMessage message) {
        return BerEncoder.encode(envelope(message.operation(), message.messageId(), message.controls()));
    }

    public Tag envelope(Tag operation, long messageId, List<Tag> controls) {
        List<Tag> fields = new ArrayList<>();
        fields.add(BerPrimitives.integer(messageId));
        fields.add(operation);
        if (!controls.isEmpty()) {
            fields.add(Tag.constructed(CONTROLS, controls));
        }
        return Tag.constructed(SEQUENCE, fields);
    }

    /**
     * Decodes exactly one LDAPMessage; the buffer must hold nothing else.
     */
    public LdapMessage decode(byte[] frame) {
        return decode(BerDecoder.decodeSingle(frame));
    }

    public LdapMessage decode(Tag envelope) {
        if (!envelope.is(SEQUENCE) || !envelope.constructed()) {
            throw invalid("LDAP message must be a constructed SEQUENCE, got " + envelope.tagClass());
        }
        List<Tag> fields = envelope.children();
        if (fields.size() < 2 || fields.size() > 3) {
            throw invalid("LDAP message must contain a message ID, an operation and optional controls, got "
                + fields.size() + " fields");
        }

        Tag id = fields.get(0);
        if (!id.is(INTEGER) || id.type().structure() != Structure.PRIMITIVE) {
            throw invalid("LDAP message ID must be a primitive INTEGER, got " + id.tagClass());
        }
        long messageId = BerPrimitives.integerValue(id);
        if (messageId < 0 || messageId > MAX_MESSAGE_ID) {
            throw invalid("LDAP message ID out of range: " + messageId);
        }

        List<Tag> controls = List.of();
        if (fields.size() == 3) {
            Tag controlsTag = fields.get(2);
            if (!controlsTag.is(CONTROLS) || !controlsTag.constructed()) {
                throw invalid("Unexpected LDAP message field " + controlsTag.tagClass() + " after the operation");
            }
            controls = controlsTag.children();
        }
        return new LdapMessage(messageId, fields.get(1), controls);
    }

    private InvalidAsn1Exception invalid(String message) {
        return new InvalidAsn1Exception(Reason.INVALID_ENVELOPE, message);
    }
}
