// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.device;

import java.util.List;

/**
 * Enumerates connected hardware wallets.
 *
 * <p>
 * Implementations own transport details (USB HID, APDU framing); none of that is visible here.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HardwareWalletHub {

    /**
     * @return the currently connected wallets, possibly empty
     * @throws DeviceCommunicationException if the hub itself cannot be reached
     */
    List<HardwareWallet> wallets() throws DeviceCommunicationException;
}
