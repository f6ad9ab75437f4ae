// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core;

/**
 * Global toggle for verbose debug logging of signing and device operations.
 *
 * <p>The initial state comes from the {@value #DEBUG_PROPERTY} system property:
 * {@code true} enables every category. Categories can be flipped at runtime.
 *
 * <p>Thread safety: the flags are volatile. The compound check in {@link #isEnabled()}
 * is not atomic, which is fine for best-effort logging.
 */
public final class SigilDebug {

    /** System property that enables all debug categories at startup. */
    public static final String DEBUG_PROPERTY = "sigil.debug";

    private static volatile boolean signingLogging = Boolean.getBoolean(DEBUG_PROPERTY);
    private static volatile boolean deviceLogging = Boolean.getBoolean(DEBUG_PROPERTY);

    private SigilDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either signing or device logging is enabled
     */
    public static boolean isEnabled() {
        return signingLogging || deviceLogging;
    }

    public static void setEnabled(final boolean enabled) {
        signingLogging = enabled;
        deviceLogging = enabled;
    }

    public static void setSigningLogging(final boolean enabled) {
        signingLogging = enabled;
    }

    public static boolean isSigningLoggingEnabled() {
        return signingLogging;
    }

    public static void setDeviceLogging(final boolean enabled) {
        deviceLogging = enabled;
    }

    public static boolean isDeviceLoggingEnabled() {
        return deviceLogging;
    }
}
