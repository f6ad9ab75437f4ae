// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core;

import java.util.Locale;

/**
 * Formatter for signing-pipeline log lines.
 *
 * <p>
 * All lines use a bracketed {@code [OPERATION]} tag and status symbols
 * (✓ ✗ ○) for success, failure and waiting. Long hex values are shortened to
 * {@code 0x1234...5678}, durations are shown as {@code 1.50ms} or {@code 10.00s}.
 *
 * <pre>{@code
 * DebugLogger.logSigning(LogFormatter.formatResolve("mnemonic", "m/44'/60'/0'/0/0"));
 * // [RESOLVE] source=mnemonic path=m/44'/60'/0'/0/0
 *
 * DebugLogger.logSigning(LogFormatter.formatSign("key", signer, digest, 1200));
 * // ✓ [SIGN] backend=key signer=0xf39f...2266 digest=0x1c8a...eac8 duration=1.20ms
 * }</pre>
 *
 * <p>
 * Pure functions; the returned strings are handed to {@link DebugLogger}.
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened hash, including "0x". */
    private static final int HASH_PREFIX_LENGTH = 6;

    /** Characters kept at the end of a shortened hash. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RESOLVE] source=device path=m/44'/60'/0'/0/0
     */
    public static String formatResolve(String source, String path) {
        return String.format("[RESOLVE] source=%s path=%s", source, path);
    }

    /**
     * Format: [DERIVE] depth=5 path=m/44'/60'/0'/0/0 duration=12.00ms
     */
    public static String formatDerive(int depth, String path, long durationMicros) {
        return String.format("[DERIVE] depth=%d path=%s %s", depth, path, duration(durationMicros));
    }

    /**
     * Format: [DEVICE] id=ledger-1 action=open
     */
    public static String formatDevice(String deviceId, String action) {
        return String.format("[DEVICE] id=%s action=%s", deviceId, action);
    }

    /**
     * Format: ○ [DEVICE-WAIT] signer=0x1234...5678 awaiting on-device approval
     */
    public static String formatDeviceWait(String signer) {
        return String.format("○ [DEVICE-WAIT] signer=%s awaiting on-device approval", shortenHash(signer));
    }

    /**
     * Format: ✓ [SIGN] backend=key signer=0x1234...5678 digest=0xabcd...ef01 duration=1.20ms
     */
    public static String formatSign(String backend, String signer, String digest, long durationMicros) {
        return String.format("✓ [SIGN] backend=%s signer=%s digest=%s %s",
                backend, shortenHash(signer), shortenHash(digest), duration(durationMicros));
    }

    /**
     * Format: ✗ [SIGN-ERROR] kind=DEVICE message=user declined duration=3.00s
     */
    public static String formatSignError(String kind, String message, long durationMicros) {
        return String.format("✗ [SIGN-ERROR] kind=%s message=%s %s", kind, message, duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return "duration=" + formatted;
    }

    /**
     * Shortens a hash to {@code 0xabcd...ef12}; short or null values are returned unchanged.
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
