package it.ldap.network;

import java.io.IOException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import it.ldap.protocol.LdapMessageCodec;
import lombok.Getter;

@Component
public class LdapClientFactory {

    private final LdapTransport transport;
    private final LdapMessageCodec codec;
    @Getter
    private final String defaultEndpoint;
    private final int maxMessageSize;

    public LdapClientFactory(
        LdapTransport transport,
        LdapMessageCodec codec,
        @Value("${ldap.client.endpoint:localhost:389}") String defaultEndpoint,
        @Value("${ldap.client.max-message-size:10485760}") int maxMessageSize
    ) {
        this.transport = transport;
        this.codec = codec;
        this.defaultEndpoint = defaultEndpoint;
        this.maxMessageSize = maxMessageSize;
    }

    public LdapClient open() throws IOException {
        return open(defaultEndpoint);
    }

    public LdapClient open(String endpoint) throws IOException {
        return new LdapClient(transport.connect(endpoint), codec, maxMessageSize);
    }
}
