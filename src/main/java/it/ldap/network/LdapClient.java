package it.ldap.network;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.util.HexFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.ldap.asn1.Tag;
import it.ldap.protocol.LdapMessage;
import it.ldap.protocol.LdapMessageCodec;

/**
 * One LDAP session over a connection: numbers outgoing messages and re-frames
 * incoming ones.
 */
public class LdapClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LdapClient.class);
    private static final int READ_CHUNK_SIZE = 4096;
    private static final int HEX_PREVIEW_OCTETS = 64;

    private final LdapConnection connection;
    private final LdapMessageCodec codec;
    private final BerFrameAccumulator frames;
    private int nextMessageId = 1;
    private final byte[] readBuffer = new byte[READ_CHUNK_SIZE];

    public LdapClient(LdapConnection connection, LdapMessageCodec codec, int maxMessageSize) {
        this.connection = connection;
        this.codec = codec;
        this.frames = new BerFrameAccumulator(maxMessageSize);
    }

    /**
     * Sends {@code operation} under a fresh message ID.
     *
     * @return the message ID used
     */
    public synchronized int send(Tag operation) throws IOException {
        int messageId = nextMessageId();
        byte[] frame = codec.encode(operation, messageId);
        if (logger.isDebugEnabled()) {
            logger.debug("Sending LDAP message {} {} to {} ({} octets): {}",
                messageId, new LdapMessage(messageId, operation).operationName(), connection.getEndpoint(), frame.length, preview(frame));
        }
        connection.write(frame);
        return messageId;
    }

    /**
     * Blocks until one whole LDAPMessage has arrived.
     */
    public LdapMessage receive() throws IOException {
        while (true) {
            byte[] frame = frames.next();
            if (frame != null) {
                LdapMessage message = codec.decode(frame);
                if (logger.isDebugEnabled()) {
                    logger.debug("Received LDAP message {} {} from {} ({} octets): {}",
                        message.messageId(), message.operationName(), connection.getEndpoint(), frame.length, preview(frame));
                }
                return message;
            }

            int read = connection.readInto(readBuffer);
            if (read < 0) {
                throw new EOFException(frames.hasPartialData()
                    ? "Connection to " + connection.getEndpoint() + " closed in the middle of an LDAP message"
                    : "Connection to " + connection.getEndpoint() + " closed by peer");
            }
            frames.receive(readBuffer, 0, read);
        }
    }

    public String getEndpoint() {
        return connection.getEndpoint();
    }

    @Override
    public void close() throws IOException {
        connection.close();
    }

    // guarded by send()
    private int nextMessageId() {
        int id = nextMessageId;
        nextMessageId = id == Integer.MAX_VALUE ? 1 : id + 1;
        return id;
    }

    private static String preview(byte[] frame) {
        int shown = Math.min(frame.length, HEX_PREVIEW_OCTETS);
        String hex = HexFormat.of().formatHex(frame, 0, shown);
        return shown < frame.length ? hex + "..." : hex;
    }
}
