// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.device;

import sh.sigil.core.crypto.hd.DerivationPath;
import sh.sigil.signer.digest.Digest;

/**
 * An open session on a hardware wallet. Single owner; close it exactly once.
 *
 * @since 0.1.0
 */
public interface WalletSession extends AutoCloseable {

    /**
     * Asks the device for the account at {@code path}.
     *
     * @throws DeviceCommunicationException if the device refuses or the transport fails
     */
    DeviceAccount deriveAccount(DerivationPath path) throws DeviceCommunicationException;

    /**
     * Signs a typed-data digest on the device. Blocks until the user approves or rejects.
     *
     * @return the 65-byte {@code r || s || v} signature as produced by the device
     * @throws DeviceCommunicationException if the user rejects or the transport fails
     */
    byte[] signTypedData(DeviceAccount account, Digest digest) throws DeviceCommunicationException;

    @Override
    void close() throws DeviceCommunicationException;
}
