// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import java.util.Objects;

import sh.sigil.core.crypto.PrivateKey;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Address;
import sh.sigil.signer.digest.Digest;

/**
 * Signer backed by an in-memory secp256k1 key.
 *
 * <p>
 * Signs with RFC 6979 deterministic nonces and low-s normalisation, directly over the digest
 * bytes. The same key and digest always give the same signature.
 *
 * @since 0.1.0
 */
public final class KeySigner implements Signer {

    private final PrivateKey privateKey;
    private final Address address;

    /**
     * Takes ownership of {@code privateKey}; {@link #close()} destroys it.
     *
     * @param privateKey the signing key
     */
    public KeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey cannot be null");
        this.address = privateKey.toAddress();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Signature sign(final Digest digest) {
        Objects.requireNonNull(digest, "digest cannot be null");
        return privateKey.sign(digest.bytes()).withNormalizedV();
    }

    @Override
    public void close() {
        privateKey.destroy();
    }

    public boolean isClosed() {
        return privateKey.isDestroyed();
    }

    @Override
    public String toString() {
        return "KeySigner[address=" + address + "]";
    }
}
