// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.digest;

import java.util.Arrays;
import java.util.Objects;

import sh.sigil.core.error.DigestLengthException;
import sh.sigil.primitives.Hex;

/**
 * A 32-byte EIP-712 typed-data digest, the only thing a {@link sh.sigil.signer.Signer} signs.
 *
 * <p>The bytes are copied on the way in and on the way out.
 *
 * @param bytes exactly 32 bytes
 * @since 0.1.0
 */
public record Digest(byte[] bytes) {

    /** Digest length in bytes. */
    public static final int LENGTH = 32;

    /**
     * @throws NullPointerException  if {@code bytes} is null
     * @throws DigestLengthException if {@code bytes} is not 32 bytes long
     */
    public Digest {
        Objects.requireNonNull(bytes, "digest bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new DigestLengthException(LENGTH, bytes.length);
        }
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Hex.encode(bytes);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Digest other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Digest[" + toHex() + "]";
    }
}
