// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.Objects;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.bouncycastle.crypto.digests.SHA256Digest;

import sh.sigil.core.error.CredentialException;

/**
 * BIP-39 mnemonic validation and seed derivation (English wordlist only).
 *
 * <p>
 * Mnemonics are NFKD-normalised and runs of whitespace collapse to a single space before
 * both validation and seed derivation, so {@code "  abandon\tabandon ... about "} and its
 * canonical form produce the same seed.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039.mediawiki">BIP-39</a>
 */
final class Bip39 {

    private static final int PBKDF2_ITERATIONS = 2048;
    private static final int SEED_LENGTH_BYTES = 64;
    private static final String PBKDF2_ALGORITHM = "PBKDF2WithHmacSHA512";
    private static final String SALT_PREFIX = "mnemonic";

    private Bip39() {
    }

    /**
     * Checks word count (12, 15, 18, 21 or 24), wordlist membership and the SHA-256 checksum.
     *
     * @param mnemonic the mnemonic phrase
     * @return true if the mnemonic is valid
     */
    static boolean isValid(final String mnemonic) {
        if (mnemonic == null || mnemonic.isBlank()) {
            return false;
        }

        final String[] words = canonical(mnemonic).split(" ");
        final int wordCount = words.length;
        if (wordCount < 12 || wordCount > 24 || wordCount % 3 != 0) {
            return false;
        }
        for (String word : words) {
            if (!EnglishWordlist.contains(word)) {
                return false;
            }
        }
        return verifyChecksum(words);
    }

    /**
     * Derives the 64-byte seed with PBKDF2-HMAC-SHA512 (2048 rounds, salt
     * {@code "mnemonic" + passphrase}). Does not validate the mnemonic.
     *
     * @param mnemonic   the mnemonic phrase
     * @param passphrase the optional passphrase, empty when unused
     * @return 64-byte seed
     * @throws CredentialException of kind {@code SEED_DERIVATION} if PBKDF2 is unavailable
     */
    static byte[] toSeed(final String mnemonic, final String passphrase) {
        Objects.requireNonNull(mnemonic, "mnemonic cannot be null");
        Objects.requireNonNull(passphrase, "passphrase cannot be null");

        final char[] password = canonical(mnemonic).toCharArray();
        final byte[] salt = (SALT_PREFIX + Normalizer.normalize(passphrase, Normalizer.Form.NFKD))
                .getBytes(StandardCharsets.UTF_8);
        final var spec = new PBEKeySpec(password, salt, PBKDF2_ITERATIONS, SEED_LENGTH_BYTES * 8);
        try {
            return SecretKeyFactory.getInstance(PBKDF2_ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw CredentialException.seedDerivation(PBKDF2_ALGORITHM + " unavailable");
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
            Arrays.fill(salt, (byte) 0);
        }
    }

    static String canonical(final String mnemonic) {
        final String stripped = Normalizer.normalize(mnemonic, Normalizer.Form.NFKD).strip();
        return stripped.isEmpty() ? "" : String.join(" ", stripped.split("\\s+"));
    }

    private static boolean verifyChecksum(final String[] words) {
        final int totalBits = words.length * 11;
        final int checksumBits = words.length / 3;
        final int entropyBits = totalBits - checksumBits;

        final boolean[] bits = new boolean[totalBits];
        for (int i = 0; i < words.length; i++) {
            final int index = EnglishWordlist.getIndex(words[i]);
            for (int j = 0; j < 11; j++) {
                bits[i * 11 + j] = (index & (1 << (10 - j))) != 0;
            }
        }

        final byte[] entropy = new byte[entropyBits / 8];
        for (int i = 0; i < entropyBits; i++) {
            if (bits[i]) {
                entropy[i / 8] |= (byte) (1 << (7 - (i % 8)));
            }
        }

        final byte[] hash = sha256(entropy);
        Arrays.fill(entropy, (byte) 0);
        try {
            for (int i = 0; i < checksumBits; i++) {
                final boolean expectedBit = (hash[i / 8] & (1 << (7 - (i % 8)))) != 0;
                if (bits[entropyBits + i] != expectedBit) {
                    return false;
                }
            }
            return true;
        } finally {
            Arrays.fill(bits, false);
        }
    }

    private static byte[] sha256(final byte[] input) {
        final var digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        final byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
