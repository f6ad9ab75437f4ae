// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Address;
import sh.sigil.signer.digest.Digest;

/**
 * A resolved signing capability bound to one address.
 *
 * <p>
 * Two variants exist: {@link KeySigner} holds a local secp256k1 key (from a raw key or a
 * mnemonic), {@link DeviceSigner} delegates to an open hardware-wallet session and holds no
 * secret material. Both return signatures with {@code v} in {27, 28}.
 *
 * <p>
 * A signer owns either key material or a device session, so it is {@link AutoCloseable}:
 *
 * <pre>{@code
 * try (Signer signer = resolver.resolve(selection)) {
 *     Signature sig = signer.sign(digest);
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface Signer extends AutoCloseable permits KeySigner, DeviceSigner {

    /**
     * Returns the address this signer signs for. Stable for the signer's lifetime.
     *
     * @return the signer address
     */
    Address address();

    /**
     * Signs a 32-byte typed-data digest as-is, without hashing it again.
     *
     * @param digest the digest
     * @return 65-byte-encodable signature with {@code v} 27 or 28
     * @throws sh.sigil.core.error.CryptoException if local signing fails
     * @throws sh.sigil.core.error.DeviceException if the device fails or returns a malformed signature
     * @throws IllegalStateException               if the signer has been closed
     */
    Signature sign(Digest digest);

    /**
     * Releases key material or the device session. Idempotent; never throws.
     */
    @Override
    void close();
}
