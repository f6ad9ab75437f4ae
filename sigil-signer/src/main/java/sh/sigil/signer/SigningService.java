// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.LogFormatter;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.error.CredentialException;
import sh.sigil.core.error.CryptoException;
import sh.sigil.core.error.DeviceException;
import sh.sigil.core.error.InputException;
import sh.sigil.core.error.SigilException;
import sh.sigil.signer.device.HardwareWalletHub;
import sh.sigil.signer.digest.Digest;
import sh.sigil.signer.digest.DigestValidator;
import sh.sigil.signer.digest.TypedDataPreimage;

/**
 * One-shot signing: validate the digest, resolve the signer, sign, release the signer.
 *
 * <p>The signer is closed on every path, so keys are destroyed and device sessions released
 * before the call returns or throws. No partial result is ever returned.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * SigningService service = SigningService.builder()
 *     .hub(ledgerHub)
 *     .build();
 *
 * SignedDigest result = service.sign(CredentialSelection.ofDevice(), digestBytes);
 * System.out.println(result.toJson());
 * }</pre>
 *
 * @since 0.1.0
 */
public final class SigningService {

    private final CredentialResolver resolver;

    private SigningService(final CredentialResolver resolver) {
        this.resolver = resolver;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Service without hardware-wallet support.
     */
    public static SigningService create() {
        return builder().build();
    }

    /**
     * Validates {@code rawDigest} before touching any credential, then signs it.
     *
     * @throws sh.sigil.core.error.DigestLengthException if {@code rawDigest} is not 32 bytes
     * @see #sign(CredentialSelection, Digest)
     */
    public SignedDigest sign(final CredentialSelection selection, final byte[] rawDigest) {
        Objects.requireNonNull(selection, "selection cannot be null");
        return sign(selection, DigestValidator.validate(rawDigest));
    }

    /**
     * Hashes a 66-byte EIP-712 preimage and signs the resulting digest.
     */
    public SignedDigest signPreimage(final CredentialSelection selection, final TypedDataPreimage preimage) {
        Objects.requireNonNull(preimage, "preimage cannot be null");
        return sign(selection, preimage.digest());
    }

    /**
     * @param selection credential source
     * @param digest    digest to sign
     * @return digest, signer address and signature
     * @throws SigilException the first failure, with its specific kind
     */
    public SignedDigest sign(final CredentialSelection selection, final Digest digest) {
        Objects.requireNonNull(selection, "selection cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");

        final long start = System.nanoTime();
        try (Signer signer = resolver.resolve(selection)) {
            final Signature signature = signer.sign(digest);
            DebugLogger.logSigning(LogFormatter.formatSign(
                    backend(signer), signer.address().value(), digest.toHex(), elapsedMicros(start)));
            return new SignedDigest(digest, signer.address(), signature);
        } catch (SigilException e) {
            DebugLogger.logSigning(LogFormatter.formatSignError(kindOf(e), e.getMessage(), elapsedMicros(start)));
            throw e;
        }
    }

    private static String backend(final Signer signer) {
        return signer instanceof DeviceSigner ? "device" : "key";
    }

    static String kindOf(final SigilException e) {
        if (e instanceof InputException ie) {
            return ie.kind().name();
        }
        if (e instanceof CredentialException cre) {
            return cre.kind().name();
        }
        if (e instanceof DeviceException de) {
            return de.kind().name();
        }
        if (e instanceof CryptoException cry) {
            return cry.kind().name();
        }
        return e.getClass().getSimpleName();
    }

    private static long elapsedMicros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000;
    }

    /**
     * Builder for creating SigningService instances.
     */
    public static final class Builder {
        private @Nullable HardwareWalletHub hub;

        private Builder() {
        }

        /**
         * Hardware-wallet hub used when a selection asks for the device. Optional.
         */
        public Builder hub(final @Nullable HardwareWalletHub hub) {
            this.hub = hub;
            return this;
        }

        public SigningService build() {
            return new SigningService(new CredentialResolver(hub));
        }
    }
}
