// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Shared secp256k1 domain parameters and point helpers.
 *
 * <p>The {@link FixedPointCombMultiplier} keeps no per-call state; BouncyCastle caches its
 * precomputation tables on the curve.
 *
 * @since 0.1.0
 */
public final class Secp256k1 {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** Curve, generator, order and cofactor. */
    public static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());

    /** Group order n. */
    public static final BigInteger N = CURVE.getN();

    /** n / 2, the low-s bound from EIP-2. */
    public static final BigInteger HALF_N = N.shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1() {
    }

    /**
     * Returns true if {@code scalar} is a valid private key, i.e. in {@code [1, n)}.
     */
    public static boolean isValidPrivateScalar(final BigInteger scalar) {
        return scalar.signum() > 0 && scalar.compareTo(N) < 0;
    }

    /**
     * Computes {@code k * G}, normalised to affine coordinates.
     */
    public static ECPoint multiplyGenerator(final BigInteger k) {
        return MULTIPLIER.multiply(CURVE.getG(), k).normalize();
    }

    /**
     * Left-pads (or strips BigInteger's sign byte from) a value to exactly 32 bytes.
     */
    public static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
