// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.sigil.core.crypto.PrivateKey;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.error.CryptoException;
import sh.sigil.core.types.Address;
import sh.sigil.signer.digest.Digest;
import sh.sigil.signer.digest.DigestValidator;

class KeySignerTest {

    private static final String ANVIL_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";

    private static KeySigner signer() {
        return new KeySigner(PrivateKey.fromHex(ANVIL_KEY));
    }

    private static Digest filled(int value) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) value);
        return new Digest(bytes);
    }

    @Test
    void signsKnownDigests() {
        KeySigner signer = signer();

        assertEquals(
                "0x73eebf81a611136662d65778960c853fdcaf6eca86793ed9cabc30f2195937af"
                        + "78a07e601627da5b4cc80c0ab35f6894da19b4a01759d90c101d9c9dd1c6745d1b",
                signer.sign(DigestValidator.validateHex(
                        "0x1c8aff950685c2ed4bc3174f3472287b56d9517b9c948127319a09a7a36deac8")).toHex());
        assertEquals(
                "0xdeefdf0ded88034d659db088cb6fc7b1a14b3692204665f689a4ef7ad62de3e5"
                        + "29c002296c16b76c25f0d6f616b5b001babd69c4ec6e9fa56f4e2de551608b5b1b",
                signer.sign(DigestValidator.validateHex(
                        "0x0102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f20")).toHex());
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6, 7})
    void lastByteIsAlways27Or28(int fill) {
        byte[] bytes = signer().sign(filled(fill)).toBytes();
        int v = bytes[64] & 0xFF;

        assertTrue(v == 27 || v == 28, "v=" + v);
    }

    @Test
    void coversBothRecoveryIds() {
        KeySigner signer = signer();
        // fills 2 and 4 land on opposite y parities for this key
        assertEquals(27, signer.sign(filled(2)).v());
        assertEquals(28, signer.sign(filled(4)).v());
    }

    @Test
    void addressIsStableAcrossSigning() {
        KeySigner signer = signer();
        Address before = signer.address();
        signer.sign(filled(9));

        assertEquals(before, signer.address());
        assertEquals(new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266"), before);
    }

    @Test
    void isDeterministic() {
        assertEquals(signer().sign(filled(0x33)), signer().sign(filled(0x33)));
    }

    @Test
    void signatureRecoversToSigner() {
        KeySigner signer = signer();
        Digest digest = filled(0x55);
        Signature sig = signer.sign(digest);

        assertEquals(signer.address(), PrivateKey.recoverAddress(digest.bytes(), sig));
    }

    @Test
    void refusesAllZeroDigest() {
        CryptoException ex = assertThrows(CryptoException.class, () -> signer().sign(filled(0)));
        assertEquals(CryptoException.Kind.SIGNING, ex.kind());
    }

    @Test
    void closeDestroysKey() {
        KeySigner signer = signer();
        signer.close();
        signer.close();

        assertTrue(signer.isClosed());
        assertThrows(IllegalStateException.class, () -> signer.sign(filled(1)));
        assertFalse(signer.toString().contains("ac0974"));
    }
}
