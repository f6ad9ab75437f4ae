// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;

import sh.sigil.core.error.CryptoException;

/**
 * Deterministic ECDSA over secp256k1 with direct recovery-id computation.
 * <p>
 * Nonces follow <a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a>
 * (HMAC-SHA256), so a given key and digest always produce the same signature.
 * The recovery id is read from the y parity of {@code R = k*G} while signing, which
 * avoids a public-key recovery pass afterwards.
 * <p>
 * Signatures are low-s normalised (EIP-2). Flipping {@code s} to {@code n - s} corresponds
 * to {@code -R}, whose y coordinate has the opposite parity, so the recovery id flips too.
 * <p>
 * The digest is signed as given. Hashing is the caller's job.
 */
public final class EcdsaSigner {

    private static final int DIGEST_LENGTH = 32;

    private EcdsaSigner() {
    }

    /**
     * Signs a 32-byte digest.
     *
     * @param digest     32-byte digest, not all zero
     * @param privateKey scalar in {@code [1, n)}
     * @return signature with raw recovery id ({@code v} = 0 or 1)
     * @throws CryptoException if the digest is malformed or all zero, or the key is out of range
     */
    public static Signature sign(final byte[] digest, final BigInteger privateKey) {
        if (digest == null || digest.length != DIGEST_LENGTH) {
            throw CryptoException.signing("digest must be " + DIGEST_LENGTH + " bytes");
        }
        if (isAllZero(digest)) {
            throw CryptoException.signing("refusing to sign an all-zero digest");
        }
        if (privateKey == null || !Secp256k1.isValidPrivateScalar(privateKey)) {
            throw CryptoException.signing("private key scalar out of range");
        }

        final BigInteger n = Secp256k1.N;
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, privateKey, digest);

        final BigInteger z = new BigInteger(1, digest);

        // RFC 6979 3.2 step h.3: draw the next k whenever r or s comes out zero.
        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = Secp256k1.multiplyGenerator(k);

            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }

            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }

            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;

            if (s.compareTo(Secp256k1.HALF_N) > 0) {
                s = n.subtract(s);
                v ^= 1;
            }

            return new Signature(Secp256k1.toBytes32(r), Secp256k1.toBytes32(s), v);
        }
    }

    private static boolean isAllZero(final byte[] bytes) {
        int acc = 0;
        for (byte b : bytes) {
            acc |= b;
        }
        return acc == 0;
    }
}
