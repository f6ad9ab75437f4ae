// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.sigil.primitives.Hex;

/**
 * Seed vectors from the reference BIP-39 test suite (trezor/python-mnemonic).
 */
class Bip39Test {

    private static final String ABANDON_ABOUT =
            "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about";

    @ParameterizedTest
    @ValueSource(strings = {
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about",
        "legal winner thank year wave sausage worth useful legal winner thank yellow",
        "letter advice cage absurd amount doctor acoustic avoid letter advice cage above",
        "zoo zoo zoo zoo zoo zoo zoo zoo zoo zoo zoo wrong",
        "test test test test test test test test test test test junk",
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon "
                + "abandon abandon address",
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon "
                + "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon art"
    })
    void acceptsValidMnemonics(String mnemonic) {
        assertTrue(Bip39.isValid(mnemonic));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "   ",
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon",
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about",
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about",
        "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon bitcoin",
        "Abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about"
    })
    void rejectsInvalidMnemonics(String mnemonic) {
        assertFalse(Bip39.isValid(mnemonic));
    }

    @Test
    void rejectsNull() {
        assertFalse(Bip39.isValid(null));
    }

    @Test
    void toleratesIrregularWhitespace() {
        String messy = "  abandon\tabandon  abandon abandon abandon abandon abandon abandon abandon abandon abandon\nabout ";

        assertTrue(Bip39.isValid(messy));
        assertArrayEquals(Bip39.toSeed(ABANDON_ABOUT, ""), Bip39.toSeed(messy, ""));
    }

    @Test
    void derivesSeedWithoutPassphrase() {
        assertEquals(
                "0x5eb00bbddcf069084889a8ab9155568165f5c453ccb85e70811aaed6f6da5fc1"
                        + "9a5ac40b389cd370d086206dec8aa6c43daea6690f20ad3d8d48b2d2ce9e38e4",
                Hex.encode(Bip39.toSeed(ABANDON_ABOUT, "")));
    }

    @Test
    void derivesSeedWithPassphrase() {
        assertEquals(
                "0xc55257c360c07c72029aebc1b53c05ed0362ada38ead3e3e9efa3708e5349553"
                        + "1f09a6987599d18264c1e1c92f2cf141630c7a3c4ab7c81b2f001698e7463b04",
                Hex.encode(Bip39.toSeed(ABANDON_ABOUT, "TREZOR")));
    }

    @Test
    void toSeedRejectsNulls() {
        assertThrows(NullPointerException.class, () -> Bip39.toSeed(null, ""));
        assertThrows(NullPointerException.class, () -> Bip39.toSeed(ABANDON_ABOUT, null));
    }
}
