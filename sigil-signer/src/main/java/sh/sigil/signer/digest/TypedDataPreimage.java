// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.digest;

import java.util.Arrays;
import java.util.Objects;

import sh.sigil.core.crypto.Keccak256;
import sh.sigil.core.error.InputException;
import sh.sigil.primitives.Hex;

/**
 * The 66-byte EIP-712 signing input {@code 0x19 0x01 || domainSeparator || structHash}.
 *
 * <p>
 * Wallet tooling frequently hands this encoding around instead of its hash. {@link #digest()}
 * produces the 32-byte value a signer actually signs.
 *
 * <pre>{@code
 * TypedDataPreimage preimage = TypedDataPreimage.parseHex("0x1901...");
 * Digest digest = preimage.digest(); // keccak256 of all 66 bytes
 * }</pre>
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 * @since 0.1.0
 */
public final class TypedDataPreimage {

    /** Length of the encoded preimage. */
    public static final int LENGTH = 66;

    private static final byte PREFIX = 0x19;
    private static final byte VERSION = 0x01;

    private final byte[] bytes;

    private TypedDataPreimage(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * @param encoded the 66-byte preimage
     * @return the parsed preimage
     * @throws InputException of kind {@code INVALID_PREIMAGE} on a wrong length or prefix
     */
    public static TypedDataPreimage parse(final byte[] encoded) {
        Objects.requireNonNull(encoded, "preimage cannot be null");
        if (encoded.length != LENGTH) {
            throw InputException.invalidPreimage(
                    "expected " + LENGTH + " bytes, got " + encoded.length + " bytes");
        }
        if (encoded[0] != PREFIX || encoded[1] != VERSION) {
            throw InputException.invalidPreimage("must start with 0x1901");
        }
        return new TypedDataPreimage(encoded.clone());
    }

    /**
     * Hex variant of {@link #parse(byte[])}; surrounding whitespace and {@code 0x} are optional.
     *
     * @throws InputException of kind {@code INVALID_DIGEST_ENCODING} if the text is not hex,
     *                        or {@code INVALID_PREIMAGE} if the decoded bytes are malformed
     */
    public static TypedDataPreimage parseHex(final String hex) {
        Objects.requireNonNull(hex, "preimage hex cannot be null");
        final byte[] decoded;
        try {
            decoded = Hex.decode(hex.strip());
        } catch (IllegalArgumentException e) {
            throw InputException.invalidDigestEncoding(e);
        }
        return parse(decoded);
    }

    /**
     * Builds the preimage from its two 32-byte hashes.
     */
    public static TypedDataPreimage of(final byte[] domainSeparator, final byte[] structHash) {
        Objects.requireNonNull(domainSeparator, "domainSeparator cannot be null");
        Objects.requireNonNull(structHash, "structHash cannot be null");
        if (domainSeparator.length != 32 || structHash.length != 32) {
            throw InputException.invalidPreimage("domain separator and struct hash must be 32 bytes each");
        }
        final byte[] encoded = new byte[LENGTH];
        encoded[0] = PREFIX;
        encoded[1] = VERSION;
        System.arraycopy(domainSeparator, 0, encoded, 2, 32);
        System.arraycopy(structHash, 0, encoded, 34, 32);
        return new TypedDataPreimage(encoded);
    }

    public byte[] domainSeparator() {
        return Arrays.copyOfRange(bytes, 2, 34);
    }

    public byte[] structHash() {
        return Arrays.copyOfRange(bytes, 34, LENGTH);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * @return keccak256 of the full 66-byte encoding
     */
    public Digest digest() {
        return new Digest(Keccak256.hash(bytes));
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof TypedDataPreimage other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "TypedDataPreimage[" + Hex.encode(bytes) + "]";
    }
}
