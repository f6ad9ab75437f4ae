// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import java.util.Arrays;
import java.util.Objects;

import sh.sigil.core.error.CredentialException;

/**
 * BIP-32 derivation path: a non-empty sequence of unsigned 32-bit child indices.
 *
 * <p>
 * Text form is {@code m/c1/c2/...}. A component ending in {@code '} or {@code h} is hardened
 * and must be below 2<sup>31</sup>; the hardening offset {@code 0x80000000} is then added.
 * A component without a marker may take any value below 2<sup>32</sup>, so
 * {@code m/2147483692} and {@code m/44'} denote the same index.
 *
 * <p>
 * Indices are stored as Java {@code int}s holding the unsigned value: a hardened index is
 * negative.
 *
 * <pre>{@code
 * DerivationPath.parse("m/44'/60'/0'/0/0");  // same as DerivationPath.DEFAULT
 * DerivationPath.bip44(1, 5);               // m/44'/60'/1'/0/5
 * }</pre>
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">BIP-32</a>
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0044.mediawiki">BIP-44</a>
 * @since 0.1.0
 */
public final class DerivationPath {

    /** Offset added to an index to mark it hardened. */
    public static final int HARDENED_OFFSET = 0x80000000;

    /** Largest index a hardened component may carry before the offset. */
    public static final int MAX_HARDENED_INDEX = 0x7FFFFFFF;

    private static final int BIP44_PURPOSE = 44;
    private static final int ETH_COIN_TYPE = 60;

    /** Standard Ethereum path of the first account's first address, {@code m/44'/60'/0'/0/0}. */
    public static final DerivationPath DEFAULT = bip44(0, 0);

    private final int[] indices;

    private DerivationPath(final int[] indices) {
        this.indices = indices;
    }

    /**
     * Parses a path in {@code m/...} form.
     *
     * @param path the path text, surrounding whitespace ignored
     * @return the parsed path
     * @throws CredentialException of kind {@code INVALID_DERIVATION_PATH} if the text is malformed
     */
    public static DerivationPath parse(final String path) {
        if (path == null || path.isBlank()) {
            throw CredentialException.invalidDerivationPath("path cannot be empty");
        }
        final String trimmed = path.strip();
        if (!trimmed.startsWith("m/")) {
            throw CredentialException.invalidDerivationPath("path must start with 'm/', got: " + trimmed);
        }

        final String[] components = trimmed.substring(2).split("/", -1);
        final int[] indices = new int[components.length];
        for (int i = 0; i < components.length; i++) {
            indices[i] = parseComponent(components[i].strip(), i + 1);
        }
        return new DerivationPath(indices);
    }

    /**
     * Builds a path from raw unsigned indices (hardened ones already carrying the offset).
     *
     * @param indices at least one index
     * @return the path
     * @throws IllegalArgumentException if no index is given
     */
    public static DerivationPath of(final int... indices) {
        Objects.requireNonNull(indices, "indices cannot be null");
        if (indices.length == 0) {
            throw new IllegalArgumentException("Derivation path needs at least one component");
        }
        return new DerivationPath(indices.clone());
    }

    /**
     * Builds {@code m/44'/60'/account'/0/addressIndex}.
     *
     * @throws IllegalArgumentException if either argument is negative
     */
    public static DerivationPath bip44(final int account, final int addressIndex) {
        if (account < 0) {
            throw new IllegalArgumentException("Account index cannot be negative: " + account);
        }
        if (addressIndex < 0) {
            throw new IllegalArgumentException("Address index cannot be negative: " + addressIndex);
        }
        return new DerivationPath(new int[] {
            BIP44_PURPOSE | HARDENED_OFFSET,
            ETH_COIN_TYPE | HARDENED_OFFSET,
            account | HARDENED_OFFSET,
            0,
            addressIndex
        });
    }

    public int size() {
        return indices.length;
    }

    /**
     * @param position zero-based component position
     * @return the raw index at that position, hardened indices negative
     */
    public int get(final int position) {
        return indices[position];
    }

    public boolean isHardened(final int position) {
        return indices[position] < 0;
    }

    /**
     * @return a copy of the raw indices
     */
    public int[] indices() {
        return indices.clone();
    }

    private static int parseComponent(final String component, final int position) {
        if (component.isEmpty()) {
            throw CredentialException.invalidDerivationPath("empty component at position " + position);
        }
        final boolean hardened = component.endsWith("'") || component.endsWith("h");
        final String digits = hardened ? component.substring(0, component.length() - 1) : component;
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw CredentialException.invalidDerivationPath(
                    "invalid component '" + component + "' at position " + position);
        }

        final long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw CredentialException.invalidDerivationPath(
                    "component '" + component + "' out of range at position " + position);
        }
        if (hardened) {
            if (value > MAX_HARDENED_INDEX) {
                throw CredentialException.invalidDerivationPath(
                        "hardened component '" + component + "' out of range at position " + position);
            }
            return (int) value | HARDENED_OFFSET;
        }
        if (value > 0xFFFFFFFFL) {
            throw CredentialException.invalidDerivationPath(
                    "component '" + component + "' out of range at position " + position);
        }
        return (int) value;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof DerivationPath other && Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indices);
    }

    /**
     * Canonical text form using {@code '} for hardened components.
     */
    @Override
    public String toString() {
        final var sb = new StringBuilder("m");
        for (int index : indices) {
            sb.append('/');
            if (index < 0) {
                sb.append(index & MAX_HARDENED_INDEX).append('\'');
            } else {
                sb.append(index);
            }
        }
        return sb.toString();
    }
}
