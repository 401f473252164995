package it.ldap.network;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import it.ldap.security.TLSContextFactory;

@Component
public class SocketLdapTransport implements LdapTransport {

    private static final Logger logger = LoggerFactory.getLogger(SocketLdapTransport.class);

    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final SSLContext sslContext;

    @Autowired
    public SocketLdapTransport(
        TLSContextFactory tlsContextFactory,
        @Value("${ldap.client.connect-timeout-ms:5000}") int connectTimeoutMs,
        @Value("${ldap.client.read-timeout-ms:30000}") int readTimeoutMs,
        @Value("${ldap.client.tls.enabled:false}") boolean tlsEnabled,
        @Value("${ldap.client.tls.truststore.path:}") String truststorePath,
        @Value("${ldap.client.tls.truststore.password:}") String truststorePassword,
        @Value("${ldap.client.tls.revocation-enabled:false}") boolean revocationEnabled
    ) {
        this(connectTimeoutMs, readTimeoutMs, tlsEnabled
            ? tlsContextFactory.create(truststorePath, truststorePassword, revocationEnabled)
            : null);
    }

    SocketLdapTransport(int connectTimeoutMs, int readTimeoutMs, SSLContext sslContext) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.sslContext = sslContext;
    }

    @Override
    public LdapConnection connect(String endpoint) throws IOException {
        Endpoint target = Endpoint.parse(endpoint, sslContext == null ? Endpoint.LDAP_PORT : Endpoint.LDAPS_PORT);
        Socket socket = sslContext == null ? new Socket() : sslContext.getSocketFactory().createSocket();
        SocketLdapConnection connection;
        try {
            socket.connect(new InetSocketAddress(target.host(), target.port()), connectTimeoutMs);
            socket.setSoTimeout(readTimeoutMs);
            socket.setTcpNoDelay(true);
            if (socket instanceof SSLSocket sslSocket) {
                SSLParameters parameters = sslSocket.getSSLParameters();
                parameters.setEndpointIdentificationAlgorithm("LDAPS");
                sslSocket.setSSLParameters(parameters);
                sslSocket.startHandshake();
            }
            connection = new SocketLdapConnection(target.toString(), socket);
        } catch (IOException | RuntimeException ex) {
            socket.close();
            throw ex;
        }
        logger.info("LDAP connection established to {}{}", target, sslContext == null ? "" : " (TLS)");
        return connection;
    }
}
