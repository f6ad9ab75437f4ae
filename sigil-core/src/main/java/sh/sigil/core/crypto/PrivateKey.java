// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.math.ec.ECPoint;

import sh.sigil.core.types.Address;
import sh.sigil.primitives.Hex;

/**
 * secp256k1 private key with Ethereum address derivation and deterministic signing.
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x4c08...2318");
 * Address address = key.toAddress();
 * Signature signature = key.sign(digest);      // v = 0 or 1
 * Address recovered = PrivateKey.recoverAddress(digest, signature);
 * }</pre>
 *
 * <h2>Key lifetime</h2>
 *
 * <p>
 * Input byte arrays are zeroed as soon as the scalar has been read. {@link #destroy()}
 * drops the scalar and public point and makes every later operation fail. BigInteger is
 * immutable, so the scalar itself cannot be overwritten; dropping the reference is the
 * most the platform allows.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        try {
            if (keyBytes.length != PRIVATE_KEY_SIZE) {
                throw new IllegalArgumentException(
                        "Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
            }

            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (value.compareTo(Secp256k1.N) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }

            this.privateKeyValue = value;
            this.publicKey = Secp256k1.multiplyGenerator(value);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if the hex is malformed, not 32 bytes, zero or
     *                                  not below the curve order
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString.strip()));
    }

    /**
     * Creates a private key from raw bytes.
     *
     * @apiNote Takes ownership of {@code keyBytes} and zeroes it. Pass a copy if the
     *          caller still needs the bytes.
     *
     * @param keyBytes 32-byte big-endian scalar (will be zeroed)
     * @return private key instance
     * @throws IllegalArgumentException if the bytes are not a valid scalar
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * Derives the Ethereum address: the last 20 bytes of
     * {@code keccak256(x || y)} of the uncompressed public key.
     *
     * @return Ethereum address
     * @throws IllegalStateException if the key has been destroyed
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return addressOf(pubKey);
    }

    /**
     * Signs a 32-byte digest with RFC 6979 nonces and low-s normalisation.
     *
     * @param digest 32-byte digest
     * @return signature with raw recovery id ({@code v} = 0 or 1)
     * @throws sh.sigil.core.error.CryptoException if the curve operation refuses the digest
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] digest) {
        Objects.requireNonNull(digest, "digest cannot be null");
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return EcdsaSigner.sign(digest, key);
    }

    /**
     * Recovers the signer address from a digest and signature.
     *
     * <p>Accepts {@code v} as 0/1 or 27/28.
     *
     * @param digest    32-byte digest that was signed
     * @param signature the signature
     * @return recovered Ethereum address
     * @throws IllegalArgumentException if recovery fails
     */
    public static Address recoverAddress(final byte[] digest, final Signature signature) {
        Objects.requireNonNull(digest, "digest cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");

        if (digest.length != 32) {
            throw new IllegalArgumentException("Digest must be 32 bytes");
        }

        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());

        final int recoveryId;
        try {
            recoveryId = signature.recoveryId();
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }

        final ECPoint publicKey;
        try {
            publicKey = recoverPublicKey(r, s, digest, recoveryId);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return addressOf(publicKey);
    }

    private static Address addressOf(final ECPoint point) {
        final byte[] pubKeyBytes = point.getEncoded(false); // 0x04 || x || y
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(pubKeyBytes, 1, pubKeyBytes.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    /**
     * Q = r^-1 * (s*R - e*G), where R is the curve point with x = r and the given y parity.
     */
    private static ECPoint recoverPublicKey(
            final BigInteger r,
            final BigInteger s,
            final byte[] digest,
            final int recoveryId) {
        final BigInteger n = Secp256k1.N;
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            return null;
        }

        final byte[] compressed = new byte[33];
        compressed[0] = (byte) ((recoveryId & 1) == 1 ? 0x03 : 0x02);
        System.arraycopy(Secp256k1.toBytes32(r), 0, compressed, 1, 32);
        final ECPoint bigR = Secp256k1.CURVE.getCurve().decodePoint(compressed);
        if (!bigR.isValid() || !bigR.multiply(n).isInfinity()) {
            return null;
        }

        final BigInteger e = new BigInteger(1, digest);
        final BigInteger rInv = r.modInverse(n);
        final BigInteger srInv = rInv.multiply(s).mod(n);
        final BigInteger eInv = rInv.multiply(e).mod(n);

        return bigR.multiply(srInv).subtract(Secp256k1.CURVE.getG().multiply(eInv)).normalize();
    }

    /**
     * Drops the key material. Every later operation throws {@link IllegalStateException}.
     */
    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Shows the derived address, never key bytes.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
