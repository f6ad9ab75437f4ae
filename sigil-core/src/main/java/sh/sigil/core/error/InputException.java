// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Thrown when the caller's input is malformed: a digest of the wrong shape, or a
 * credential selection that does not name exactly one source.
 *
 * @since 0.1.0
 */
public sealed class InputException extends SigilException permits DigestLengthException {

    /**
     * Categorizes the input failure.
     */
    public enum Kind {
        /** Zero or more than one credential source was selected. */
        AMBIGUOUS_CREDENTIAL_SELECTION,
        /** The digest did not decode to the accepted fixed length. */
        DIGEST_LENGTH,
        /** The digest text was not valid hex. */
        INVALID_DIGEST_ENCODING,
        /** The EIP-712 preimage was not {@code 0x1901 || domainSeparator || structHash}. */
        INVALID_PREIMAGE
    }

    private final Kind kind;

    public InputException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public InputException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    /**
     * The caller selected {@code count} credential sources instead of exactly one.
     */
    public static InputException ambiguousSelection(final int count) {
        return new InputException(Kind.AMBIGUOUS_CREDENTIAL_SELECTION,
                "Exactly one of private key, mnemonic or hardware wallet must be selected, got " + count);
    }

    /**
     * The digest text could not be decoded as hex.
     */
    public static InputException invalidDigestEncoding(final Throwable cause) {
        return new InputException(Kind.INVALID_DIGEST_ENCODING,
                "Digest is not a valid hex string: " + cause.getMessage(), cause);
    }

    /**
     * The EIP-712 preimage had the wrong length or prefix.
     */
    public static InputException invalidPreimage(final String reason) {
        return new InputException(Kind.INVALID_PREIMAGE, "Invalid EIP-712 preimage: " + reason);
    }
}
