// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.device;

/**
 * One connected hardware wallet.
 *
 * @since 0.1.0
 */
public interface HardwareWallet {

    /**
     * Transport-level identifier used in logs and error messages, e.g. a USB path.
     */
    String id();

    /**
     * Opens a session. Fails when the device is locked or already in use.
     *
     * @param passphrase device passphrase, empty when unused
     * @return an open session owned by the caller
     * @throws DeviceCommunicationException if the device cannot be opened
     */
    WalletSession open(String passphrase) throws DeviceCommunicationException;
}
