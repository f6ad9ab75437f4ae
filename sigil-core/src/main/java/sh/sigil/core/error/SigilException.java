// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Base runtime exception for all signing failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every failure of a
 * signing operation can be caught with a single clause while each branch keeps its own
 * {@code Kind}. A failed operation never yields a partial result.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * SigilException
 * ├── {@link InputException} - bad digest shape or credential selection count
 * │   └── {@link DigestLengthException} - digest of the wrong length
 * ├── {@link CredentialException} - bad mnemonic, private key or derivation path
 * ├── {@link DeviceException} - hardware wallet missing, ambiguous, locked or refusing
 * └── {@link CryptoException} - curve operation failure
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     SignedDigest result = service.sign(selection, digest);
 * } catch (DeviceException e) {
 *     // re-prompt the user explicitly; never loop on approval prompts
 * } catch (SigilException e) {
 *     // report e.getMessage() and exit
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class SigilException extends RuntimeException
        permits InputException,
        CredentialException,
        DeviceException,
        CryptoException {

    public SigilException(final String message) {
        super(message);
    }

    public SigilException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
