// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.LogFormatter;
import sh.sigil.core.crypto.PrivateKey;
import sh.sigil.core.crypto.hd.DerivationPath;
import sh.sigil.core.crypto.hd.KeyDerivation;
import sh.sigil.core.error.CredentialException;
import sh.sigil.core.error.DeviceException;
import sh.sigil.core.error.InputException;
import sh.sigil.signer.device.DeviceAccount;
import sh.sigil.signer.device.DeviceCommunicationException;
import sh.sigil.signer.device.HardwareWallet;
import sh.sigil.signer.device.HardwareWalletHub;
import sh.sigil.signer.device.WalletSession;

/**
 * Turns a {@link CredentialSelection} into a ready {@link Signer}.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>exactly one source must be selected, else {@code AMBIGUOUS_CREDENTIAL_SELECTION};</li>
 *   <li>the derivation path is parsed, for every source;</li>
 *   <li>the selected source builds the signer.</li>
 * </ol>
 *
 * <p>For the hardware-wallet source exactly one device must be connected. No session is
 * opened when several are, and a session opened here is closed again if account derivation
 * fails. On success the returned {@link DeviceSigner} owns the session.
 *
 * @since 0.1.0
 */
public final class CredentialResolver {

    private final @Nullable HardwareWalletHub hub;

    /**
     * Resolver without hardware-wallet support; selecting the device fails with
     * {@code HUB_UNAVAILABLE}.
     */
    public CredentialResolver() {
        this(null);
    }

    public CredentialResolver(final @Nullable HardwareWalletHub hub) {
        this.hub = hub;
    }

    /**
     * Positional variant matching the command-line flags of signing tools.
     *
     * @param rawKeyHex private key hex, or null/blank when not used
     * @param mnemonic  mnemonic, or null/blank when not used
     * @param useDevice whether to use the connected hardware wallet
     * @param hdPath    derivation path text
     * @return the signer
     */
    public Signer resolve(
            final @Nullable String rawKeyHex,
            final @Nullable String mnemonic,
            final boolean useDevice,
            final String hdPath) {
        return resolve(CredentialSelection.builder()
                .privateKey(rawKeyHex)
                .mnemonic(mnemonic)
                .useDevice(useDevice)
                .hdPath(hdPath)
                .build());
    }

    /**
     * @param selection the credential selection
     * @return a signer owned by the caller
     * @throws InputException      if not exactly one source is selected
     * @throws CredentialException if the path, key or mnemonic is invalid
     * @throws DeviceException     if the hardware wallet cannot be used
     */
    public Signer resolve(final CredentialSelection selection) {
        Objects.requireNonNull(selection, "selection cannot be null");

        final int sources = selection.sourceCount();
        if (sources != 1) {
            throw InputException.ambiguousSelection(sources);
        }

        final DerivationPath path = DerivationPath.parse(selection.hdPath());

        if (selection.hasRawKey()) {
            DebugLogger.logSigning(LogFormatter.formatResolve("private-key", "n/a"));
            return new KeySigner(parsePrivateKey(selection.rawKeyHex()));
        }
        if (selection.hasMnemonic()) {
            DebugLogger.logSigning(LogFormatter.formatResolve("mnemonic", path.toString()));
            return new KeySigner(KeyDerivation.derive(selection.mnemonic(), selection.mnemonicPassphrase(), path));
        }
        DebugLogger.logSigning(LogFormatter.formatResolve("device", path.toString()));
        return openDevice(path, selection.devicePassphrase());
    }

    private static PrivateKey parsePrivateKey(final @Nullable String rawKeyHex) {
        try {
            return PrivateKey.fromHex(Objects.requireNonNull(rawKeyHex));
        } catch (IllegalArgumentException e) {
            throw CredentialException.invalidPrivateKey(e);
        }
    }

    private DeviceSigner openDevice(final DerivationPath path, final String passphrase) {
        if (hub == null) {
            throw DeviceException.hubUnavailable("no hardware wallet hub configured", null);
        }

        final List<HardwareWallet> wallets;
        try {
            wallets = hub.wallets();
        } catch (DeviceCommunicationException e) {
            throw DeviceException.hubUnavailable(e.getMessage(), e);
        }
        if (wallets == null || wallets.isEmpty()) {
            throw DeviceException.noDeviceFound();
        }
        if (wallets.size() > 1) {
            throw DeviceException.ambiguousDevice(wallets.size());
        }

        final HardwareWallet wallet = wallets.get(0);
        final String deviceId = wallet.id();
        DebugLogger.logDevice(LogFormatter.formatDevice(deviceId, "open"));

        final WalletSession session;
        try {
            session = wallet.open(passphrase);
        } catch (DeviceCommunicationException e) {
            throw DeviceException.lockedOrUnavailable(deviceId, e);
        }

        final DeviceAccount account;
        try {
            account = session.deriveAccount(path);
        } catch (DeviceCommunicationException e) {
            DeviceSigner.closeQuietly(deviceId, session);
            throw DeviceException.derivation(path.toString(), e);
        } catch (RuntimeException e) {
            DeviceSigner.closeQuietly(deviceId, session);
            throw e;
        }
        if (account == null) {
            DeviceSigner.closeQuietly(deviceId, session);
            throw DeviceException.derivation(path.toString(), null);
        }

        DebugLogger.logDevice(LogFormatter.formatDevice(deviceId, "derived " + path));
        return new DeviceSigner(deviceId, session, account);
    }
}
