package it.ldap.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.ConnectException;

import org.junit.jupiter.api.Test;

import it.ldap.asn1.BerPrimitives;
import it.ldap.asn1.Tag;
import it.ldap.asn1.TagClass;
import it.ldap.network.LdapClient;
import it.ldap.network.LdapClientFactory;
import it.ldap.protocol.LdapMessage;
import it.ldap.protocol.LdapOperations;
import it.ldap.protocol.LdapResult;
import it.ldap.protocol.LdapTagMap;

class LdapProbeServiceTest {

    private static final String ENDPOINT = "ldap.example.org:389";

    private final LdapClientFactory factory = mock(LdapClientFactory.class);
    private final LdapClient client = mock(LdapClient.class);

    @Test
    void shouldBindThenUnbind() throws Exception {
        when(factory.open(ENDPOINT)).thenReturn(client);
        when(client.send(any())).thenReturn(1, 2);
        when(client.receive()).thenReturn(new LdapMessage(1, bindResponse(0, "")));
        LdapProbeService service = new LdapProbeService(factory, true, "cn=admin,dc=example,dc=org", "secret");

        LdapResult result = service.probe(ENDPOINT);

        assertTrue(result.success());
        verify(client).send(LdapOperations.simpleBind("cn=admin,dc=example,dc=org", "secret"));
        verify(client).send(LdapOperations.unbind());
        verify(client).close();
    }

    @Test
    void shouldReportRejectedCredentials() throws Exception {
        when(factory.open(ENDPOINT)).thenReturn(client);
        when(client.send(any())).thenReturn(1, 2);
        when(client.receive()).thenReturn(new LdapMessage(1, bindResponse(49, "invalid credentials")));
        LdapProbeService service = new LdapProbeService(factory, true, "cn=admin", "wrong");

        LdapResult result = service.probe(ENDPOINT);

        assertFalse(result.success());
        assertEquals(49, result.resultCode());
        assertEquals("invalid credentials", result.diagnosticMessage());
    }

    @Test
    void shouldRejectResponseToAnotherMessage() throws Exception {
        when(factory.open(ENDPOINT)).thenReturn(client);
        when(client.send(any())).thenReturn(1);
        when(client.receive()).thenReturn(new LdapMessage(7, bindResponse(0, "")));
        LdapProbeService service = new LdapProbeService(factory, true, "", "");

        assertThrows(IllegalStateException.class, () -> service.probe(ENDPOINT));
        verify(client, never()).send(LdapOperations.unbind());
        verify(client).close();
    }

    @Test
    void shouldWrapTransportFailures() throws Exception {
        when(factory.open(ENDPOINT)).thenThrow(new ConnectException("Connection refused"));
        LdapProbeService service = new LdapProbeService(factory, true, "", "");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> service.probe(ENDPOINT));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void shouldUseEndpointArgumentWhenRunning() throws Exception {
        when(factory.open("override:1389")).thenReturn(client);
        when(client.send(any())).thenReturn(1, 2);
        when(client.receive()).thenReturn(new LdapMessage(1, bindResponse(0, "")));

        new LdapProbeService(factory, true, "", "").run("override:1389");

        verify(factory).open("override:1389");
    }

    @Test
    void shouldStayIdleWhenDisabled() throws Exception {
        new LdapProbeService(factory, false, "", "").run();

        verifyNoInteractions(factory);
    }

    private Tag bindResponse(int resultCode, String diagnostic) {
        return Tag.constructed(TagClass.application(LdapTagMap.BIND_RESPONSE),
            BerPrimitives.enumerated(resultCode),
            BerPrimitives.octetString(""),
            BerPrimitives.octetString(diagnostic));
    }
}
