// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import java.util.Arrays;
import java.util.Objects;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.LogFormatter;
import sh.sigil.core.crypto.PrivateKey;
import sh.sigil.core.error.CredentialException;

/**
 * Derives a secp256k1 private key from a BIP-39 mnemonic along a BIP-32 path.
 *
 * <pre>{@code
 * PrivateKey key = KeyDerivation.derive(
 *         "test test test test test test test test test test test junk",
 *         DerivationPath.DEFAULT);
 * key.toAddress(); // 0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266
 * }</pre>
 *
 * <p>
 * The result is a pure function of {@code (mnemonic, passphrase, path)}. Seed bytes, the
 * master key and every intermediate key are zeroed before this method returns; the caller
 * owns the returned key and should {@link PrivateKey#destroy() destroy} it when done.
 *
 * @since 0.1.0
 */
public final class KeyDerivation {

    private KeyDerivation() {
    }

    /**
     * Derives with an empty passphrase.
     *
     * @see #derive(String, String, DerivationPath)
     */
    public static PrivateKey derive(final String mnemonic, final DerivationPath path) {
        return derive(mnemonic, "", path);
    }

    /**
     * @param mnemonic   English BIP-39 mnemonic
     * @param passphrase BIP-39 passphrase, empty when unused
     * @param path       derivation path
     * @return the derived private key
     * @throws CredentialException of kind {@code INVALID_MNEMONIC}, {@code SEED_DERIVATION},
     *                             {@code DERIVATION} or {@code KEY_DECODE}
     */
    public static PrivateKey derive(final String mnemonic, final String passphrase, final DerivationPath path) {
        Objects.requireNonNull(mnemonic, "mnemonic cannot be null");
        Objects.requireNonNull(passphrase, "passphrase cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        if (!Bip39.isValid(mnemonic)) {
            throw CredentialException.invalidMnemonic();
        }

        final long start = System.nanoTime();
        final byte[] seed = Bip39.toSeed(mnemonic, passphrase);
        final Bip32.ExtendedKey master;
        try {
            master = Bip32.masterKey(seed);
        } finally {
            Arrays.fill(seed, (byte) 0);
        }

        final Bip32.ExtendedKey leaf;
        try {
            leaf = Bip32.derivePath(master, path);
        } finally {
            master.destroy();
        }

        final PrivateKey key;
        try {
            key = PrivateKey.fromBytes(leaf.keyBytes());
        } catch (IllegalArgumentException e) {
            throw CredentialException.keyDecode(e);
        } finally {
            leaf.destroy();
        }

        DebugLogger.logSigning(LogFormatter.formatDerive(
                path.size(), path.toString(), (System.nanoTime() - start) / 1_000));
        return key;
    }
}
