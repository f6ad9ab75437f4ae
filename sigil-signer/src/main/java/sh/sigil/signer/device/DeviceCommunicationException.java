// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer.device;

/**
 * Raised by a hardware-wallet collaborator when talking to the device fails.
 *
 * <p>
 * Callers translate it into a {@link sh.sigil.core.error.DeviceException} of the kind matching
 * the operation that failed.
 *
 * @since 0.1.0
 */
public class DeviceCommunicationException extends Exception {

    private static final long serialVersionUID = 1L;

    public DeviceCommunicationException(final String message) {
        super(message);
    }

    public DeviceCommunicationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
