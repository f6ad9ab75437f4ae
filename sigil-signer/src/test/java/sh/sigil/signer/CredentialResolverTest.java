// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.sigil.core.crypto.hd.DerivationPath;
import sh.sigil.core.error.CredentialException;
import sh.sigil.core.error.DeviceException;
import sh.sigil.core.error.InputException;
import sh.sigil.core.types.Address;
import sh.sigil.signer.device.DeviceAccount;
import sh.sigil.signer.device.DeviceCommunicationException;
import sh.sigil.signer.device.HardwareWallet;
import sh.sigil.signer.device.HardwareWalletHub;
import sh.sigil.signer.device.WalletSession;

@ExtendWith(MockitoExtension.class)
class CredentialResolverTest {

    private static final String ANVIL_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String TEST_JUNK = "test test test test test test test test test test test junk";
    private static final Address ANVIL_0 = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");

    @Mock
    private HardwareWalletHub hub;

    @Mock
    private HardwareWallet wallet;

    @Mock
    private HardwareWallet otherWallet;

    @Mock
    private WalletSession session;

    @Nested
    class Selection {

        @Test
        void rejectsNoSource() {
            InputException ex = assertThrows(InputException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.builder().build()));

            assertEquals(InputException.Kind.AMBIGUOUS_CREDENTIAL_SELECTION, ex.kind());
            verifyNoInteractions(hub);
        }

        @Test
        void rejectsKeyAndMnemonic() {
            CredentialSelection selection = CredentialSelection.builder()
                    .privateKey(ANVIL_KEY)
                    .mnemonic(TEST_JUNK)
                    .build();

            InputException ex = assertThrows(InputException.class,
                    () -> new CredentialResolver(hub).resolve(selection));
            assertEquals(InputException.Kind.AMBIGUOUS_CREDENTIAL_SELECTION, ex.kind());
        }

        @Test
        void rejectsAllThreeBeforeTouchingDevice() {
            InputException ex = assertThrows(InputException.class,
                    () -> new CredentialResolver(hub).resolve(ANVIL_KEY, TEST_JUNK, true, "m/44'/60'/0'/0/0"));

            assertEquals(InputException.Kind.AMBIGUOUS_CREDENTIAL_SELECTION, ex.kind());
            verifyNoInteractions(hub);
        }

        @Test
        void exclusivityIsCheckedBeforePath() {
            CredentialSelection selection = CredentialSelection.builder()
                    .privateKey(ANVIL_KEY)
                    .useDevice(true)
                    .hdPath("not a path")
                    .build();

            assertThrows(InputException.class, () -> new CredentialResolver(hub).resolve(selection));
        }

        @Test
        void blankValuesDoNotCount() {
            Signer signer = new CredentialResolver().resolve("  ", TEST_JUNK, false, "m/44'/60'/0'/0/0");
            assertEquals(ANVIL_0, signer.address());
        }

        @Test
        void toStringHidesSecrets() {
            String text = CredentialSelection.builder()
                    .mnemonic(TEST_JUNK)
                    .mnemonicPassphrase("hunter2")
                    .build()
                    .toString();

            assertFalse(text.contains("junk"));
            assertFalse(text.contains("hunter2"));
        }
    }

    @Nested
    class RawKey {

        @Test
        void resolvesWithAndWithoutPrefix() {
            CredentialResolver resolver = new CredentialResolver();

            assertEquals(ANVIL_0, resolver.resolve(CredentialSelection.ofPrivateKey(ANVIL_KEY)).address());
            assertEquals(ANVIL_0,
                    resolver.resolve(CredentialSelection.ofPrivateKey(ANVIL_KEY.substring(2))).address());
            assertInstanceOf(KeySigner.class, resolver.resolve(CredentialSelection.ofPrivateKey(ANVIL_KEY)));
        }

        @Test
        void pathIsStillValidated() {
            CredentialSelection selection = CredentialSelection.builder()
                    .privateKey(ANVIL_KEY)
                    .hdPath("m/44'/x")
                    .build();

            CredentialException ex = assertThrows(CredentialException.class,
                    () -> new CredentialResolver().resolve(selection));
            assertEquals(CredentialException.Kind.INVALID_DERIVATION_PATH, ex.kind());
        }

        @Test
        void rejectsMalformedKeys() {
            CredentialResolver resolver = new CredentialResolver();
            for (String bad : List.of("0x1234", "0xzz" + "00".repeat(31), "0x" + "00".repeat(32),
                    "0xfffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141")) {
                CredentialException ex = assertThrows(CredentialException.class,
                        () -> resolver.resolve(CredentialSelection.ofPrivateKey(bad)));
                assertEquals(CredentialException.Kind.INVALID_PRIVATE_KEY_ENCODING, ex.kind());
            }
        }

        @Test
        void errorDoesNotEchoKey() {
            String bad = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ffzz";
            CredentialException ex = assertThrows(CredentialException.class,
                    () -> new CredentialResolver().resolve(CredentialSelection.ofPrivateKey(bad)));
            assertFalse(ex.getMessage().contains("ac0974"));
        }
    }

    @Nested
    class Mnemonic {

        @Test
        void derivesAtDefaultPath() {
            Signer signer = new CredentialResolver().resolve(CredentialSelection.ofMnemonic(TEST_JUNK));
            assertEquals(ANVIL_0, signer.address());
        }

        @Test
        void derivesAtCustomPath() {
            Signer signer = new CredentialResolver().resolve(null, TEST_JUNK, false, "m/44'/60'/0'/0/1");
            assertEquals(new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8"), signer.address());
        }

        @Test
        void appliesPassphrase() {
            CredentialSelection selection = CredentialSelection.builder()
                    .mnemonic("abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon "
                            + "abandon about")
                    .mnemonicPassphrase("TREZOR")
                    .build();

            assertEquals(new Address("0x9c32f71d4db8fb9e1a58b0a80df79935e7256fa6"),
                    new CredentialResolver().resolve(selection).address());
        }

        @Test
        void rejectsBadChecksum() {
            CredentialException ex = assertThrows(CredentialException.class,
                    () -> new CredentialResolver().resolve(CredentialSelection.ofMnemonic(
                            "test test test test test test test test test test test test")));
            assertEquals(CredentialException.Kind.INVALID_MNEMONIC, ex.kind());
        }
    }

    @Nested
    class Device {

        @Test
        void failsWithoutHub() {
            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver().resolve(CredentialSelection.ofDevice()));
            assertEquals(DeviceException.Kind.HUB_UNAVAILABLE, ex.kind());
        }

        @Test
        void reportsHubFailure() throws Exception {
            when(hub.wallets()).thenThrow(new DeviceCommunicationException("usb stack down"));

            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.ofDevice()));
            assertEquals(DeviceException.Kind.HUB_UNAVAILABLE, ex.kind());
        }

        @Test
        void reportsNoDevice() throws Exception {
            when(hub.wallets()).thenReturn(List.of());

            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.ofDevice()));
            assertEquals(DeviceException.Kind.NO_DEVICE_FOUND, ex.kind());
        }

        @Test
        void refusesToPickBetweenTwoDevices() throws Exception {
            when(hub.wallets()).thenReturn(List.of(wallet, otherWallet));

            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.ofDevice()));

            assertEquals(DeviceException.Kind.AMBIGUOUS_DEVICE, ex.kind());
            verify(wallet, never()).open(anyString());
            verify(otherWallet, never()).open(anyString());
        }

        @Test
        void reportsLockedDevice() throws Exception {
            DeviceCommunicationException locked = new DeviceCommunicationException("device locked");
            when(hub.wallets()).thenReturn(List.of(wallet));
            when(wallet.id()).thenReturn("hid:1");
            when(wallet.open("")).thenThrow(locked);

            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.ofDevice()));

            assertEquals(DeviceException.Kind.LOCKED_OR_UNAVAILABLE, ex.kind());
            assertSame(locked, ex.getCause());
        }

        @Test
        void closesSessionWhenDerivationFails() throws Exception {
            when(hub.wallets()).thenReturn(List.of(wallet));
            when(wallet.id()).thenReturn("hid:1");
            when(wallet.open("")).thenReturn(session);
            when(session.deriveAccount(DerivationPath.DEFAULT))
                    .thenThrow(new DeviceCommunicationException("app not open"));

            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.ofDevice()));

            assertEquals(DeviceException.Kind.DERIVATION, ex.kind());
            verify(session).close();
        }

        @Test
        void closeFailureDoesNotMaskDerivationError() throws Exception {
            when(hub.wallets()).thenReturn(List.of(wallet));
            when(wallet.id()).thenReturn("hid:1");
            when(wallet.open("")).thenReturn(session);
            when(session.deriveAccount(any())).thenThrow(new DeviceCommunicationException("app not open"));
            doThrow(new DeviceCommunicationException("gone")).when(session).close();

            DeviceException ex = assertThrows(DeviceException.class,
                    () -> new CredentialResolver(hub).resolve(CredentialSelection.ofDevice()));
            assertEquals(DeviceException.Kind.DERIVATION, ex.kind());
        }

        @Test
        void resolvesSingleDevice() throws Exception {
            DerivationPath path = DerivationPath.parse("m/44'/60'/2'/0/7");
            DeviceAccount account = new DeviceAccount(ANVIL_0, path);
            when(hub.wallets()).thenReturn(List.of(wallet));
            when(wallet.id()).thenReturn("hid:1");
            when(wallet.open("pin-phrase")).thenReturn(session);
            when(session.deriveAccount(path)).thenReturn(account);

            CredentialSelection selection = CredentialSelection.builder()
                    .useDevice(true)
                    .hdPath("m/44h/60h/2h/0/7")
                    .devicePassphrase("pin-phrase")
                    .build();
            Signer signer = new CredentialResolver(hub).resolve(selection);

            DeviceSigner deviceSigner = assertInstanceOf(DeviceSigner.class, signer);
            assertEquals(ANVIL_0, deviceSigner.address());
            assertEquals(account, deviceSigner.account());
            verify(session, never()).close();
        }
    }
}
