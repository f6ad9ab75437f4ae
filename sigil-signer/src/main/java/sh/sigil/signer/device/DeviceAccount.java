// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.device;

import java.util.Objects;

import sh.sigil.core.crypto.hd.DerivationPath;
import sh.sigil.core.types.Address;

/**
 * Account reported by a hardware wallet for a derivation path.
 *
 * @param address the account address
 * @param path    the path it was derived at
 * @since 0.1.0
 */
public record DeviceAccount(Address address, DerivationPath path) {

    public DeviceAccount {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
    }
}
