// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Which credential source to sign with, and how to reach the key.
 *
 * <p>Exactly one of private key, mnemonic or hardware wallet must be chosen; the
 * {@link CredentialResolver} rejects anything else. The derivation path applies to the
 * mnemonic and hardware-wallet sources and defaults to {@value #DEFAULT_HD_PATH}.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var selection = CredentialSelection.builder()
 *     .mnemonic("test test test test test test test test test test test junk")
 *     .hdPath("m/44'/60'/0'/0/1")
 *     .build();
 * }</pre>
 *
 * <p>{@link #toString()} never shows the key, the mnemonic or either passphrase.
 *
 * @since 0.1.0
 */
public final class CredentialSelection {

    /** Default derivation path: first address of the first Ethereum account. */
    public static final String DEFAULT_HD_PATH = "m/44'/60'/0'/0/0";

    private final @Nullable String rawKeyHex;
    private final @Nullable String mnemonic;
    private final boolean useDevice;
    private final String hdPath;
    private final String mnemonicPassphrase;
    private final String devicePassphrase;

    private CredentialSelection(final Builder builder) {
        this.rawKeyHex = builder.rawKeyHex;
        this.mnemonic = builder.mnemonic;
        this.useDevice = builder.useDevice;
        this.hdPath = builder.hdPath;
        this.mnemonicPassphrase = builder.mnemonicPassphrase;
        this.devicePassphrase = builder.devicePassphrase;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Selects a raw private key at the default path.
     */
    public static CredentialSelection ofPrivateKey(final String rawKeyHex) {
        return builder().privateKey(rawKeyHex).build();
    }

    /**
     * Selects a mnemonic at the default path.
     */
    public static CredentialSelection ofMnemonic(final String mnemonic) {
        return builder().mnemonic(mnemonic).build();
    }

    /**
     * Selects the single connected hardware wallet at the default path.
     */
    public static CredentialSelection ofDevice() {
        return builder().useDevice(true).build();
    }

    public @Nullable String rawKeyHex() {
        return rawKeyHex;
    }

    public @Nullable String mnemonic() {
        return mnemonic;
    }

    public boolean useDevice() {
        return useDevice;
    }

    public String hdPath() {
        return hdPath;
    }

    public String mnemonicPassphrase() {
        return mnemonicPassphrase;
    }

    public String devicePassphrase() {
        return devicePassphrase;
    }

    boolean hasRawKey() {
        return isPresent(rawKeyHex);
    }

    boolean hasMnemonic() {
        return isPresent(mnemonic);
    }

    /**
     * Number of credential sources selected. Blank strings do not count.
     */
    public int sourceCount() {
        int count = 0;
        if (hasRawKey()) {
            count++;
        }
        if (hasMnemonic()) {
            count++;
        }
        if (useDevice) {
            count++;
        }
        return count;
    }

    private static boolean isPresent(final @Nullable String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "CredentialSelection{"
                + "privateKey=" + (hasRawKey() ? "***" : "none")
                + ", mnemonic=" + (hasMnemonic() ? "***" : "none")
                + ", useDevice=" + useDevice
                + ", hdPath=" + hdPath
                + '}';
    }

    /**
     * Builder for creating CredentialSelection instances.
     */
    public static final class Builder {
        private @Nullable String rawKeyHex;
        private @Nullable String mnemonic;
        private boolean useDevice;
        private String hdPath = DEFAULT_HD_PATH;
        private String mnemonicPassphrase = "";
        private String devicePassphrase = "";

        private Builder() {
        }

        /**
         * @param rawKeyHex hex-encoded 32-byte key, {@code 0x} prefix optional
         */
        public Builder privateKey(final @Nullable String rawKeyHex) {
            this.rawKeyHex = rawKeyHex;
            return this;
        }

        public Builder mnemonic(final @Nullable String mnemonic) {
            this.mnemonic = mnemonic;
            return this;
        }

        public Builder useDevice(final boolean useDevice) {
            this.useDevice = useDevice;
            return this;
        }

        /**
         * @param hdPath BIP-32 path text such as {@code m/44'/60'/0'/0/0}
         */
        public Builder hdPath(final String hdPath) {
            this.hdPath = Objects.requireNonNull(hdPath, "hdPath cannot be null");
            return this;
        }

        /**
         * BIP-39 passphrase mixed into the seed; empty by default.
         */
        public Builder mnemonicPassphrase(final String passphrase) {
            this.mnemonicPassphrase = Objects.requireNonNull(passphrase, "passphrase cannot be null");
            return this;
        }

        /**
         * Passphrase handed to the hardware wallet when opening it; empty by default.
         */
        public Builder devicePassphrase(final String passphrase) {
            this.devicePassphrase = Objects.requireNonNull(passphrase, "passphrase cannot be null");
            return this;
        }

        public CredentialSelection build() {
            return new CredentialSelection(this);
        }
    }
}
