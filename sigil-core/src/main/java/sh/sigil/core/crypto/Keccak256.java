// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 hashing for Ethereum.
 *
 * <p>
 * Ethereum uses the original Keccak padding, not the standardised SHA3-256. This class
 * wraps BouncyCastle's {@link Keccak.Digest256}; a fresh digest is created per call
 * because signing runs once per invocation.
 *
 * <pre>{@code
 * byte[] digest = Keccak256.hash(preimage);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        return new Keccak.Digest256().digest(input);
    }

    /**
     * Computes the Keccak-256 hash of several arrays concatenated, without building the
     * concatenation.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Keccak.Digest256 digest = new Keccak.Digest256();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }
}
