// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.sigil.primitives.Hex;

/**
 * 65-byte secp256k1 ECDSA signature {@code r || s || v}.
 *
 * <p>
 * Freshly computed signatures carry the raw recovery id ({@code v} = 0 or 1). Anything
 * handed back to a caller is normalised to the {@code v} = 27 or 28 convention that
 * EIP-712 verifiers ({@code ecrecover}) expect; see {@link #withNormalizedV()}.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature (low-s normalised)
 * @param v recovery id, either raw (0, 1) or offset (27, 28)
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Length of the serialised form. */
    public static final int LENGTH = 65;

    /** Offset added to the raw recovery id for the {@code ecrecover} convention. */
    public static final int RECOVERY_ID_OFFSET = 27;

    /**
     * Maximum bytes to display in full hex in toString().
     */
    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        if (v < 0 || v > 0xFF) {
            throw new IllegalArgumentException("v must fit in one byte, got " + v);
        }

        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses the 65-byte {@code r || s || v} form.
     *
     * @param bytes 65 bytes
     * @return the signature, with {@code v} exactly as encoded
     * @throws IllegalArgumentException if {@code bytes} is not 65 bytes long
     */
    public static Signature fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Signature must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Signature(
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64),
                bytes[64] & 0xFF);
    }

    /**
     * Returns a copy of the r component (32 bytes).
     */
    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    /**
     * Returns a copy of the s component (32 bytes).
     */
    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Serialises to 65 bytes {@code r || s || v}.
     *
     * @return a new 65-byte array
     */
    public byte[] toBytes() {
        final byte[] out = new byte[LENGTH];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return out;
    }

    /**
     * Returns the raw recovery id (0 or 1) regardless of encoding.
     *
     * @return 0 or 1
     * @throws IllegalStateException if {@code v} is neither raw nor offset
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == RECOVERY_ID_OFFSET || v == RECOVERY_ID_OFFSET + 1) {
            return v - RECOVERY_ID_OFFSET;
        }
        throw new IllegalStateException("Unsupported recovery id encoding: v=" + v);
    }

    /**
     * Returns true if {@code v} is already 27 or 28.
     */
    public boolean isNormalized() {
        return v == RECOVERY_ID_OFFSET || v == RECOVERY_ID_OFFSET + 1;
    }

    /**
     * Returns this signature with {@code v} moved into the 27/28 convention.
     *
     * @return {@code this} if already normalised, otherwise a copy with {@code v + 27}
     * @throws IllegalStateException if {@code v} is neither raw nor offset
     */
    public Signature withNormalizedV() {
        if (isNormalized()) {
            return this;
        }
        return new Signature(r, s, recoveryId() + RECOVERY_ID_OFFSET);
    }

    /**
     * Returns the 65-byte form as {@code 0x}-prefixed hex.
     */
    public String toHex() {
        return Hex.encode(toBytes());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + bytesToHex(r) + ", s=" + bytesToHex(s) + ", v=" + v + "]";
    }

    private static String bytesToHex(byte[] bytes) {
        if (bytes.length > MAX_BYTES_TO_DISPLAY) {
            return bytes.length + " bytes";
        }
        return Hex.encodeNoPrefix(bytes);
    }
}
