// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.digest;

import java.util.Objects;

import sh.sigil.core.error.DigestLengthException;
import sh.sigil.core.error.InputException;
import sh.sigil.primitives.Hex;

/**
 * Entry checks for caller-supplied digests.
 *
 * @since 0.1.0
 */
public final class DigestValidator {

    private DigestValidator() {
    }

    /**
     * @param candidate raw digest bytes
     * @return the digest
     * @throws NullPointerException  if {@code candidate} is null
     * @throws DigestLengthException if {@code candidate} is not 32 bytes, reporting the actual length
     */
    public static Digest validate(final byte[] candidate) {
        Objects.requireNonNull(candidate, "digest cannot be null");
        return new Digest(candidate);
    }

    /**
     * Decodes hex text (surrounding whitespace and the {@code 0x} prefix are optional) and
     * validates the result.
     *
     * @param hex hex-encoded digest
     * @return the digest
     * @throws InputException        of kind {@code INVALID_DIGEST_ENCODING} if the text is not hex
     * @throws DigestLengthException if the decoded bytes are not 32 bytes long
     */
    public static Digest validateHex(final String hex) {
        Objects.requireNonNull(hex, "digest hex cannot be null");
        final byte[] decoded;
        try {
            decoded = Hex.decode(hex.strip());
        } catch (IllegalArgumentException e) {
            throw InputException.invalidDigestEncoding(e);
        }
        return validate(decoded);
    }
}
