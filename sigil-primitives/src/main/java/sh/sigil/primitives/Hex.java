// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding with optional {@code 0x} prefixes.
 *
 * <p>
 * Decoding errors never echo the input string, because the same codec is used for
 * private keys. Messages report the offending position instead.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix, into bytes.
     *
     * @param hexString the string to decode
     * @return the decoded bytes (empty for {@code "0x"} or {@code ""})
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  digits, or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have an even number of digits, got " + hexLength);
        }

        final byte[] result = new byte[hexLength / 2];
        for (int i = 0; i < result.length; i++) {
            final int pos = start + i * 2;
            final int high = toNibble(hexString.charAt(pos), pos);
            final int low = toNibble(hexString.charAt(pos + 1), pos + 1);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encodes bytes as a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as a lowercase hex string without a prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Removes a leading {@code 0x}/{@code 0X} if present.
     *
     * @param hexString the hex string
     * @return the string without prefix
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns whether the string starts with {@code 0x} or {@code 0X}.
     *
     * @param hexString the string to check
     * @return true if prefixed
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns whether the string is well-formed hex (optional prefix, even digit count).
     *
     * @param hexString the string to check
     * @return true if {@link #decode(String)} would succeed
     */
    public static boolean isValid(final String hexString) {
        if (hexString == null) {
            return false;
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        if (((hexString.length() - start) & 1) == 1) {
            return false;
        }
        for (int i = start; i < hexString.length(); i++) {
            final char c = hexString.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static int toNibble(final char c, final int position) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character at position " + position);
        }
        return NIBBLE_LOOKUP[c];
    }
}
