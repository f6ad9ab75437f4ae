// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private key, mnemonic and passphrase values, in both JSON
 * ({@code "privateKey":"..."}) and key=value ({@code mnemonic=...}) form</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String SECRET_KEYS = "privateKey|rawKeyHex|mnemonic|passphrase";

    /** Matches "privateKey":"...", "mnemonic":"..." and friends. */
    private static final Pattern JSON_SECRET_PATTERN =
            Pattern.compile("\"(" + SECRET_KEYS + ")\"\\s*:\\s*\"[^\"]*\"");

    /** Matches privateKey=..., mnemonic='...' up to the next separator. */
    private static final Pattern KV_SECRET_PATTERN =
            Pattern.compile("\\b(" + SECRET_KEYS + ")=('[^']*'|\"[^\"]*\"|[^,\\]}\\s]+)");

    private static final String REDACTED = "***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = JSON_SECRET_PATTERN.matcher(input).replaceAll("\"$1\":\"" + REDACTED + "\"");
        sanitized = KV_SECRET_PATTERN.matcher(sanitized).replaceAll("$1=" + REDACTED);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
