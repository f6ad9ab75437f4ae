// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.sigil.core.crypto.Keccak256;
import sh.sigil.primitives.Hex;

/**
 * Hex-encoded 20-byte Ethereum account address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase. Use {@link #toChecksumHex()} for the EIP-55
 * mixed-case rendering users expect to see.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return 20-byte array representation
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    /**
     * Renders the address with the EIP-55 checksum casing.
     *
     * <p>Each hex letter is upper-cased when the matching nibble of
     * {@code keccak256(lowercaseHexWithoutPrefix)} is 8 or more.
     *
     * @return mixed-case address, e.g. {@code 0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266}
     * @see <a href="https://eips.ethereum.org/EIPS/eip-55">EIP-55</a>
     */
    public String toChecksumHex() {
        final String lower = value.substring(2);
        final byte[] hash = Keccak256.hash(lower.getBytes(StandardCharsets.US_ASCII));
        final StringBuilder sb = new StringBuilder(42).append("0x");
        for (int i = 0; i < lower.length(); i++) {
            final char c = lower.charAt(i);
            final int nibble = (i % 2 == 0) ? (hash[i / 2] >>> 4) & 0x0F : hash[i / 2] & 0x0F;
            sb.append(Character.isLetter(c) && nibble >= 8 ? Character.toUpperCase(c) : c);
        }
        return sb.toString();
    }
}
