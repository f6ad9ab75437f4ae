// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.sigil.core.error.CredentialException;
import sh.sigil.primitives.Hex;

/**
 * Tests for BIP-32 private child derivation.
 * <p>
 * Test vectors from:
 * <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki#test-vectors">BIP-32 Test Vectors</a>
 */
class Bip32Test {

    // BIP-32 Test Vector 2 seed (64 bytes)
    private static final byte[] TEST_VECTOR_2_SEED = Hex.decode(
            "fffcf9f6f3f0edeae7e4e1dedbd8d5d2cfccc9c6c3c0bdbab7b4b1aeaba8a5a29f9c999693908d8a8784817e7b7875726f6c696663605d5a5754514e4b484542");

    @Test
    void masterKeyMatchesTestVector2() {
        Bip32.ExtendedKey master = Bip32.masterKey(TEST_VECTOR_2_SEED);

        assertEquals("0x4b03d6fc340455b363f51020ad3ecca4f0850280cf436c70c727923f6db46c3e",
                Hex.encode(master.keyBytes()));
        assertEquals("0x60499f801b896d83179a4374aeb7822aaeaceaa0db1f85ee3e904c4defbd9689",
                Hex.encode(master.chainCode()));
    }

    @Test
    void normalChildMatchesTestVector2() {
        Bip32.ExtendedKey child = Bip32.deriveChild(Bip32.masterKey(TEST_VECTOR_2_SEED), 0, 1);

        assertEquals("0xabe74a98f6c7eabee0428f53798f0ab8aa1bd37873999041703c742f15ac7e1e",
                Hex.encode(child.keyBytes()));
        assertEquals("0xf0909affaa7ee7abe5dd4e100598d4dc53cd709d5a5c2cac40e7412f232f7c9c",
                Hex.encode(child.chainCode()));
    }

    @Test
    void hardenedChildMatchesTestVector2() {
        Bip32.ExtendedKey master = Bip32.masterKey(TEST_VECTOR_2_SEED);
        Bip32.ExtendedKey key = Bip32.derivePath(master, DerivationPath.parse("m/0/2147483647'"));

        assertEquals("0x877c779ad9687164e9c2f4f0f4ff0340814392330693ce95a58fe18fd52e6e93",
                Hex.encode(key.keyBytes()));
    }

    @Test
    void derivePathLeavesMasterIntact() {
        Bip32.ExtendedKey master = Bip32.masterKey(TEST_VECTOR_2_SEED);
        Bip32.derivePath(master, DerivationPath.DEFAULT);

        assertFalse(master.isDestroyed());
    }

    @Test
    void masterKeyRejectsWrongSeedLength() {
        CredentialException ex = assertThrows(CredentialException.class, () -> Bip32.masterKey(new byte[32]));
        assertEquals(CredentialException.Kind.SEED_DERIVATION, ex.kind());
        assertThrows(CredentialException.class, () -> Bip32.masterKey(new byte[128]));
        assertThrows(NullPointerException.class, () -> Bip32.masterKey(null));
    }

    @Test
    void destroyedKeyZeroesAndRefusesAccess() {
        Bip32.ExtendedKey key = new Bip32.ExtendedKey(new byte[] {
            1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
            17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32
        }, new byte[32]);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, key::keyBytes);
    }

    @Test
    void formatsIndices() {
        assertEquals("44'", Bip32.formatIndex(44 | DerivationPath.HARDENED_OFFSET));
        assertEquals("7", Bip32.formatIndex(7));
    }
}
