package it.ldap.network;

import java.io.Closeable;
import java.io.IOException;

/**
 * A byte stream to a directory server. It does no framing of its own.
 */
public interface LdapConnection extends Closeable {

    String getEndpoint();

    /**
     * Writes and flushes all octets, or fails.
     */
    void write(byte[] octets) throws IOException;

    /**
     * Reads whatever is available into {@code buffer}.
     *
     * @return number of octets read, or -1 once the peer closed the stream
     */
    int readInto(byte[] buffer) throws IOException;
}
