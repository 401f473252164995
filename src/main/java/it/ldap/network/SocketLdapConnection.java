package it.ldap.network;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;

class SocketLdapConnection implements LdapConnection {

    private static final Logger logger = LoggerFactory.getLogger(SocketLdapConnection.class);

    @Getter
    private final String endpoint;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    SocketLdapConnection(String endpoint, Socket socket) throws IOException {
        this.endpoint = endpoint;
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    @Override
    public void write(byte[] octets) throws IOException {
        out.write(octets);
        out.flush();
    }

    @Override
    public int readInto(byte[] buffer) throws IOException {
        return in.read(buffer);
    }

    @Override
    public void close() throws IOException {
        if (!socket.isClosed()) {
            logger.info("Closing LDAP connection to {}", endpoint);
            socket.close();
        }
    }
}
