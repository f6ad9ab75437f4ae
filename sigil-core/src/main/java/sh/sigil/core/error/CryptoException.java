// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Thrown when the in-process ECDSA operation fails on a correctly shaped digest.
 *
 * <p>Treated as unexpected. There is no in-process recovery.
 *
 * @since 0.1.0
 */
public final class CryptoException extends SigilException {

    /**
     * Categorizes the cryptographic failure.
     */
    public enum Kind {
        /** The curve signing operation failed or refused its input. */
        SIGNING
    }

    private final Kind kind;

    public CryptoException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public CryptoException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static CryptoException signing(final String reason) {
        return new CryptoException(Kind.SIGNING, "Error signing digest: " + reason);
    }

    public static CryptoException signing(final String reason, final Throwable cause) {
        return new CryptoException(Kind.SIGNING, "Error signing digest: " + reason, cause);
    }
}
