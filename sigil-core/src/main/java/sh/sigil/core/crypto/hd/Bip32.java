// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import sh.sigil.core.crypto.Secp256k1;
import sh.sigil.core.error.CredentialException;

/**
 * BIP-32 private child key derivation over secp256k1.
 *
 * <p>
 * Only private derivation is implemented and no extended-key serialisation is produced, so
 * network version bytes never come into play.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">BIP-32</a>
 */
final class Bip32 {

    private static final byte[] BITCOIN_SEED = "Bitcoin seed".getBytes(StandardCharsets.UTF_8);
    static final int SEED_LENGTH = 64;

    private Bip32() {
    }

    /**
     * Master key = HMAC-SHA512(key "Bitcoin seed", seed), split into scalar and chain code.
     *
     * @param seed 64-byte BIP-39 seed
     * @return the master extended key
     * @throws CredentialException of kind {@code SEED_DERIVATION} if the seed length is wrong
     *                             or the master scalar is zero or not below the curve order
     */
    static ExtendedKey masterKey(final byte[] seed) {
        Objects.requireNonNull(seed, "seed cannot be null");
        if (seed.length != SEED_LENGTH) {
            throw CredentialException.seedDerivation("seed must be " + SEED_LENGTH + " bytes, got " + seed.length);
        }

        final byte[] hmacResult = hmacSha512(BITCOIN_SEED, seed);
        final byte[] keyBytes = Arrays.copyOfRange(hmacResult, 0, 32);
        final byte[] chainCode = Arrays.copyOfRange(hmacResult, 32, 64);
        Arrays.fill(hmacResult, (byte) 0);

        try {
            if (!Secp256k1.isValidPrivateScalar(new BigInteger(1, keyBytes))) {
                throw CredentialException.seedDerivation("master key is not a valid secp256k1 scalar");
            }
            return new ExtendedKey(keyBytes, chainCode);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
            Arrays.fill(chainCode, (byte) 0);
        }
    }

    /**
     * Derives one level down.
     *
     * @param parent the parent key
     * @param index  raw child index, negative when hardened
     * @param depth  one-based depth of the child, reported on failure
     * @return the child key
     * @throws CredentialException of kind {@code DERIVATION} if {@code IL >= n} or the child
     *                             scalar is zero
     */
    static ExtendedKey deriveChild(final ExtendedKey parent, final int index, final int depth) {
        Objects.requireNonNull(parent, "parent key cannot be null");

        final byte[] parentKey = parent.keyBytes();
        final byte[] data = new byte[37];
        // hardened indices have the sign bit set
        if (index < 0) {
            // 0x00 || ser256(k) || ser32(i)
            System.arraycopy(parentKey, 0, data, 1, 32);
        } else {
            // serP(point(k)) || ser32(i)
            final byte[] publicKey = Secp256k1.multiplyGenerator(new BigInteger(1, parentKey)).getEncoded(true);
            System.arraycopy(publicKey, 0, data, 0, 33);
        }
        data[33] = (byte) (index >>> 24);
        data[34] = (byte) (index >>> 16);
        data[35] = (byte) (index >>> 8);
        data[36] = (byte) index;

        final byte[] chainCode = parent.chainCode();
        final byte[] hmacResult = hmacSha512(chainCode, data);
        Arrays.fill(data, (byte) 0);
        Arrays.fill(chainCode, (byte) 0);

        final byte[] il = Arrays.copyOfRange(hmacResult, 0, 32);
        final byte[] ir = Arrays.copyOfRange(hmacResult, 32, 64);
        Arrays.fill(hmacResult, (byte) 0);

        try {
            final BigInteger ilValue = new BigInteger(1, il);
            final BigInteger childKeyValue = ilValue.add(new BigInteger(1, parentKey)).mod(Secp256k1.N);
            if (ilValue.compareTo(Secp256k1.N) >= 0 || childKeyValue.signum() == 0) {
                throw CredentialException.derivation(depth, formatIndex(index));
            }
            final byte[] childKeyBytes = Secp256k1.toBytes32(childKeyValue);
            try {
                return new ExtendedKey(childKeyBytes, ir);
            } finally {
                Arrays.fill(childKeyBytes, (byte) 0);
            }
        } finally {
            Arrays.fill(il, (byte) 0);
            Arrays.fill(ir, (byte) 0);
            Arrays.fill(parentKey, (byte) 0);
        }
    }

    /**
     * Walks {@code path} from {@code masterKey}, destroying every intermediate key as soon as
     * its child exists. The caller keeps ownership of {@code masterKey}.
     */
    static ExtendedKey derivePath(final ExtendedKey masterKey, final DerivationPath path) {
        Objects.requireNonNull(masterKey, "master key cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        ExtendedKey current = masterKey;
        for (int i = 0; i < path.size(); i++) {
            final ExtendedKey previous = current;
            try {
                current = deriveChild(previous, path.get(i), i + 1);
            } finally {
                if (previous != masterKey) {
                    previous.destroy();
                }
            }
        }
        return current;
    }

    static String formatIndex(final int index) {
        return index < 0
                ? (index & DerivationPath.MAX_HARDENED_INDEX) + "'"
                : Integer.toString(index);
    }

    private static byte[] hmacSha512(final byte[] key, final byte[] data) {
        final var hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        final byte[] result = new byte[64];
        hmac.doFinal(result, 0);
        return result;
    }

    /**
     * Private scalar and chain code. Copies in, copies out; {@link #destroy()} zeroes both.
     */
    static final class ExtendedKey {
        private final byte[] keyBytes;
        private final byte[] chainCode;
        private boolean destroyed;

        ExtendedKey(final byte[] keyBytes, final byte[] chainCode) {
            if (keyBytes == null || keyBytes.length != 32) {
                throw new IllegalArgumentException("Key bytes must be 32 bytes");
            }
            if (chainCode == null || chainCode.length != 32) {
                throw new IllegalArgumentException("Chain code must be 32 bytes");
            }
            this.keyBytes = keyBytes.clone();
            this.chainCode = chainCode.clone();
        }

        byte[] keyBytes() {
            checkNotDestroyed();
            return keyBytes.clone();
        }

        byte[] chainCode() {
            checkNotDestroyed();
            return chainCode.clone();
        }

        void destroy() {
            if (destroyed) {
                return;
            }
            Arrays.fill(keyBytes, (byte) 0);
            Arrays.fill(chainCode, (byte) 0);
            destroyed = true;
        }

        boolean isDestroyed() {
            return destroyed;
        }

        private void checkNotDestroyed() {
            if (destroyed) {
                throw new IllegalStateException("Extended key has been destroyed");
            }
        }
    }
}
