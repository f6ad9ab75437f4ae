// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.LogFormatter;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.error.DeviceException;
import sh.sigil.core.types.Address;
import sh.sigil.signer.device.DeviceAccount;
import sh.sigil.signer.device.DeviceCommunicationException;
import sh.sigil.signer.device.WalletSession;
import sh.sigil.signer.digest.Digest;

/**
 * Signer that forwards digests to an open hardware-wallet session.
 *
 * <p>
 * {@link #sign(Digest)} blocks until the user approves or rejects on the device; there is no
 * internal timeout. The device may answer with {@code v} as 0/1 or 27/28; 0/1 is moved to
 * 27/28 and any other value is rejected.
 *
 * @since 0.1.0
 */
public final class DeviceSigner implements Signer {

    private static final Logger log = LoggerFactory.getLogger(DeviceSigner.class);

    private final String deviceId;
    private final WalletSession session;
    private final DeviceAccount account;
    private boolean closed;

    DeviceSigner(final String deviceId, final WalletSession session, final DeviceAccount account) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId cannot be null");
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.account = Objects.requireNonNull(account, "account cannot be null");
    }

    @Override
    public Address address() {
        return account.address();
    }

    public DeviceAccount account() {
        return account;
    }

    @Override
    public Signature sign(final Digest digest) {
        Objects.requireNonNull(digest, "digest cannot be null");
        if (closed) {
            throw new IllegalStateException("Device session has been closed");
        }

        DebugLogger.logDevice(LogFormatter.formatDeviceWait(account.address().value()));
        final byte[] raw;
        try {
            raw = session.signTypedData(account, digest);
        } catch (DeviceCommunicationException e) {
            throw DeviceException.signing(e.getMessage(), e);
        }
        return normalize(raw);
    }

    static Signature normalize(final byte[] raw) {
        if (raw == null || raw.length != Signature.LENGTH) {
            throw DeviceException.signing("expected a " + Signature.LENGTH + "-byte signature, got "
                    + (raw == null ? "none" : raw.length + " bytes"));
        }
        final int v = raw[Signature.LENGTH - 1] & 0xFF;
        if (v != 0 && v != 1 && v != 27 && v != 28) {
            throw DeviceException.signing("unexpected recovery byte " + v);
        }
        return Signature.fromBytes(raw).withNormalizedV();
    }

    /**
     * Closes the session once. Failures are logged at WARN and not rethrown.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        DebugLogger.logDevice(LogFormatter.formatDevice(deviceId, "close"));
        closeQuietly(deviceId, session);
    }

    static void closeQuietly(final String deviceId, final WalletSession session) {
        try {
            session.close();
        } catch (DeviceCommunicationException | RuntimeException e) {
            log.warn("Failed to close hardware wallet session {}: {}", deviceId, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "DeviceSigner[device=" + deviceId + ", address=" + account.address() + ", path="
                + account.path() + "]";
    }
}
