package it.ldap.protocol;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HexFormat;

import org.junit.jupiter.api.Test;

import it.ldap.asn1.BerDecoder;
import it.ldap.asn1.BerPrimitives;
import it.ldap.asn1.InvalidAsn1Exception;
import it.ldap.asn1.Tag;

class LdapOperationsTest {

    private static final HexFormat HEX = HexFormat.of();

    private final LdapMessageCodec codec = new LdapMessageCodec();

    @Test
    void shouldEncodeAnonymousBindRequest() {
        assertArrayEquals(HEX.parseHex("300c020101" + "600702010304008000"), codec.encode(LdapOperations.anonymousBind(), 1));
    }

    @Test
    void shouldEncodeSimpleBindFields() {
        Tag bind = LdapOperations.simpleBind("cn=admin,dc=example,dc=org", "secret");

        assertEquals(3, BerPrimitives.integerValue(bind.children().get(0)));
        assertEquals("cn=admin,dc=example,dc=org", BerPrimitives.stringValue(bind.children().get(1)));
        assertEquals("secret", BerPrimitives.stringValue(bind.children().get(2)));
        assertEquals("bindRequest", new LdapMessage(1, bind).operationName());
    }

    @Test
    void shouldEncodeUnbindAsEmptyApplicationPrimitive() {
        assertArrayEquals(HEX.parseHex("3005020103" + "4200"), codec.encode(LdapOperations.unbind(), 3));
    }

    @Test
    void shouldParseBindResponseResult() {
        LdapMessage response = codec.decode(HEX.parseHex("300c020101" + "61070a0100" + "0400" + "0400"));

        assertTrue(response.isOperation(LdapTagMap.BIND_RESPONSE));
        LdapResult result = LdapResult.from(response.operation());
        assertTrue(result.success());
        assertEquals("", result.matchedDn());
    }

    @Test
    void shouldParseFailedResultWithDiagnostic() {
        Tag response = BerDecoder.decodeSingle(HEX.parseHex("610e0a0131" + "0400" + "0407" + "696e76616c6964"));

        LdapResult result = LdapResult.from(response);

        assertFalse(result.success());
        assertEquals(49, result.resultCode());
        assertEquals("invalid", result.diagnosticMessage());
    }

    @Test
    void shouldRejectResponsesThatAreNotResults() {
        assertThrows(InvalidAsn1Exception.class, () -> LdapResult.from(LdapOperations.unbind()));
        assertThrows(InvalidAsn1Exception.class,
            () -> LdapResult.from(BerDecoder.decodeSingle(HEX.parseHex("61050a01000400"))));
        assertThrows(InvalidAsn1Exception.class,
            () -> LdapResult.from(BerDecoder.decodeSingle(HEX.parseHex("6107020100" + "0400" + "0400"))));
    }

    @Test
    void shouldRejectResultCodesBeyondIntRange() {
        InvalidAsn1Exception ex = assertThrows(InvalidAsn1Exception.class,
            () -> LdapResult.from(BerDecoder.decodeSingle(HEX.parseHex("610b0a050100000000" + "0400" + "0400"))));

        assertEquals(InvalidAsn1Exception.Reason.INVALID_ENVELOPE, ex.reason());
    }

    @Test
    void shouldNameUnknownOperations() {
        assertEquals("searchResDone", LdapTagMap.operationName(5));
        assertEquals("unknown[99]", LdapTagMap.operationName(99));
    }
}
