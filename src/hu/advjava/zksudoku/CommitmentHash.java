package hu.advjava.zksudoku;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 commitments over (value, nonce).
 *
 * <p>The input bytes are a tag (scalar or sequence), the sequence length, every value as a
 * big-endian int and finally the nonce as a big-endian long, so distinct inputs never share
 * an encoding.
 */
public final class CommitmentHash {
    private static final byte SCALAR = 1;
    private static final byte SEQUENCE = 2;
    private static final HexFormat HEX = HexFormat.of();

    private CommitmentHash() {}

    public static String hash(int value, long nonce) {
        ByteBuffer buf = ByteBuffer.allocate(1 + Integer.BYTES + Long.BYTES);
        buf.put(SCALAR).putInt(value).putLong(nonce);
        return digest(buf.array());
    }

    public static String hash(int[] sequence, long nonce) {
        ByteBuffer buf = ByteBuffer.allocate(1 + Integer.BYTES * (sequence.length + 1) + Long.BYTES);
        buf.put(SEQUENCE).putInt(sequence.length);
        for (int v : sequence) buf.putInt(v);
        buf.putLong(nonce);
        return digest(buf.array());
    }

    private static String digest(byte[] input) {
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(input));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
