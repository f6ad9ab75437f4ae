// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Exception for unusable credential material: mnemonic phrases, raw private keys and
 * derivation paths, plus the BIP-32 steps that turn a mnemonic into a key.
 *
 * <p>Messages never include the offending secret. A bad mnemonic is reported as
 * "invalid", not echoed back.
 *
 * @since 0.1.0
 */
public final class CredentialException extends SigilException {

    /**
     * Categorizes the credential failure.
     */
    public enum Kind {
        /** Wrong word count, unknown word or bad checksum. */
        INVALID_MNEMONIC,
        /** Bad hex, wrong length, zero or out-of-range private key scalar. */
        INVALID_PRIVATE_KEY_ENCODING,
        /** Derivation path text could not be parsed. */
        INVALID_DERIVATION_PATH,
        /** Seed had the wrong length or produced an invalid master key. */
        SEED_DERIVATION,
        /** A BIP-32 child step produced an invalid key. */
        DERIVATION,
        /** The final derived scalar is not a valid secp256k1 private key. */
        KEY_DECODE
    }

    /** The category of credential failure. */
    private final Kind kind;

    public CredentialException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public CredentialException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the kind of credential failure.
     *
     * @return the failure kind
     */
    public Kind kind() {
        return kind;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    public static CredentialException invalidMnemonic() {
        return new CredentialException(Kind.INVALID_MNEMONIC,
                "Invalid mnemonic phrase (word count, wordlist or checksum)");
    }

    public static CredentialException invalidPrivateKey(final Throwable cause) {
        return new CredentialException(Kind.INVALID_PRIVATE_KEY_ENCODING,
                "Error parsing private key: " + cause.getMessage(), cause);
    }

    public static CredentialException invalidDerivationPath(final String reason) {
        return new CredentialException(Kind.INVALID_DERIVATION_PATH, "Invalid derivation path: " + reason);
    }

    public static CredentialException seedDerivation(final String reason) {
        return new CredentialException(Kind.SEED_DERIVATION, "Seed derivation failed: " + reason);
    }

    public static CredentialException derivation(final int depth, final String index) {
        return new CredentialException(Kind.DERIVATION,
                "Invalid child key derived at depth %d (index %s)".formatted(depth, index));
    }

    public static CredentialException keyDecode(final Throwable cause) {
        return new CredentialException(Kind.KEY_DECODE,
                "Derived key is not a valid secp256k1 private key: " + cause.getMessage(), cause);
    }
}
