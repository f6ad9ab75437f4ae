// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Exception for hardware-wallet failures.
 *
 * <p>None of these are retried automatically. Retrying an on-device approval prompt
 * must be an explicit new invocation by the user.
 *
 * @since 0.1.0
 */
public final class DeviceException extends SigilException {

    /**
     * Categorizes the hardware-wallet failure.
     */
    public enum Kind {
        /** No hub is configured, or the hub could not enumerate devices. */
        HUB_UNAVAILABLE,
        /** Enumeration returned zero devices. */
        NO_DEVICE_FOUND,
        /** Enumeration returned more than one device. */
        AMBIGUOUS_DEVICE,
        /** The session could not be opened, typically because the device is locked. */
        LOCKED_OR_UNAVAILABLE,
        /** The device could not derive the account at the requested path. */
        DERIVATION,
        /** The device rejected, aborted or garbled the signing request. */
        SIGNING
    }

    private final Kind kind;

    public DeviceException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public DeviceException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    public static DeviceException hubUnavailable(final String reason, final Throwable cause) {
        return new DeviceException(Kind.HUB_UNAVAILABLE, "Error starting hardware wallet hub: " + reason, cause);
    }

    public static DeviceException noDeviceFound() {
        return new DeviceException(Kind.NO_DEVICE_FOUND,
                "No hardware wallets found, please connect your device");
    }

    public static DeviceException ambiguousDevice(final int count) {
        return new DeviceException(Kind.AMBIGUOUS_DEVICE,
                count + " hardware wallets found, please use one device at a time");
    }

    public static DeviceException lockedOrUnavailable(final String deviceId, final Throwable cause) {
        return new DeviceException(Kind.LOCKED_OR_UNAVAILABLE,
                "Error opening hardware wallet " + deviceId + " (have you unlocked it?)", cause);
    }

    public static DeviceException derivation(final String path, final Throwable cause) {
        return new DeviceException(Kind.DERIVATION,
                "Error deriving hardware wallet account at " + path, cause);
    }

    public static DeviceException signing(final String reason, final Throwable cause) {
        return new DeviceException(Kind.SIGNING, "Hardware wallet signing failed: " + reason, cause);
    }

    public static DeviceException signing(final String reason) {
        return new DeviceException(Kind.SIGNING, "Hardware wallet signing failed: " + reason);
    }
}
