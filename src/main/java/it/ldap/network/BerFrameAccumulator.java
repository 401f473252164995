package it.ldap.network;

import java.util.Arrays;

import it.ldap.asn1.BerDecoder;
import it.ldap.asn1.InvalidAsn1Exception;
import it.ldap.asn1.InvalidAsn1Exception.Reason;

/**
 * Re-frames a byte stream into whole BER TLVs. Reads may end in the middle of a
 * message or carry several messages at once.
 */
public class BerFrameAccumulator {

    private final int maxFrameSize;
    private byte[] buffer;
    private int start;
    private int end;

    public BerFrameAccumulator(int maxFrameSize) {
        this(maxFrameSize, 4096);
    }

    public BerFrameAccumulator(int maxFrameSize, int initialCapacity) {
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("Maximum frame size must be positive: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
        this.buffer = new byte[Math.max(16, initialCapacity)];
    }

    public void receive(byte[] data, int offset, int length) {
        if (length == 0) {
            return;
        }
        ensureCapacity(length);
        System.arraycopy(data, offset, buffer, end, length);
        end += length;
    }

    /**
     * Returns the next complete TLV, or null when more octets are needed.
     */
    public byte[] next() {
        if (start == end) {
            return null;
        }
        int frameLength = BerDecoder.frameLength(buffer, start, end);
        if (frameLength < 0) {
            if (buffered() > maxFrameSize) {
                throw tooLarge(buffered());
            }
            return null;
        }
        if (frameLength > maxFrameSize) {
            throw tooLarge(frameLength);
        }
        if (buffered() < frameLength) {
            return null;
        }

        byte[] frame = Arrays.copyOfRange(buffer, start, start + frameLength);
        start += frameLength;
        if (start == end) {
            start = 0;
            end = 0;
        }
        return frame;
    }

    public boolean hasPartialData() {
        return end > start;
    }

    public int buffered() {
        return end - start;
    }

    public void reset() {
        start = 0;
        end = 0;
    }

    private void ensureCapacity(int additional) {
        int required = buffered() + additional;
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, buffered());
            end -= start;
            start = 0;
        }
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, required));
        }
    }

    private InvalidAsn1Exception tooLarge(int size) {
        return new InvalidAsn1Exception(Reason.MESSAGE_TOO_LARGE,
            "LDAP message of " + size + " octets exceeds the limit of " + maxFrameSize);
    }
}
