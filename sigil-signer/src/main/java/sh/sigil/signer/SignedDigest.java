// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.signer;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.sigil.core.crypto.PrivateKey;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Address;
import sh.sigil.primitives.Hex;
import sh.sigil.signer.digest.Digest;
import sh.sigil.signer.digest.DigestValidator;

/**
 * Outcome of a successful signing: the digest, the signer address and the 65-byte signature.
 *
 * <p>JSON form:
 * <pre>{@code
 * {"digest":"0x1c8a...eac8","signer":"0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266","signature":"0x73ee...451b"}
 * }</pre>
 *
 * @since 0.1.0
 */
@JsonPropertyOrder({"digest", "signer", "signature"})
public final class SignedDigest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Digest digest;
    private final Address address;
    private final Signature signature;

    public SignedDigest(final Digest digest, final Address address, final Signature signature) {
        this.digest = Objects.requireNonNull(digest, "digest cannot be null");
        this.address = Objects.requireNonNull(address, "address cannot be null");
        this.signature = Objects.requireNonNull(signature, "signature cannot be null");
    }

    @JsonCreator
    static SignedDigest fromHexFields(
            @JsonProperty("digest") final String digestHex,
            @JsonProperty("signer") final String signer,
            @JsonProperty("signature") final String signatureHex) {
        Objects.requireNonNull(signatureHex, "signature");
        return new SignedDigest(
                DigestValidator.validateHex(Objects.requireNonNull(digestHex, "digest")),
                new Address(signer),
                Signature.fromBytes(Hex.decode(signatureHex)));
    }

    public Digest digest() {
        return digest;
    }

    public Address address() {
        return address;
    }

    public Signature signature() {
        return signature;
    }

    @JsonProperty("digest")
    public String digestHex() {
        return digest.toHex();
    }

    /**
     * @return the signer address with EIP-55 checksum casing
     */
    @JsonProperty("signer")
    public String signerHex() {
        return address.toChecksumHex();
    }

    @JsonProperty("signature")
    public String signatureHex() {
        return signature.toHex();
    }

    /**
     * Recovers the signer from the signature and compares it with {@link #address()}.
     *
     * @return true if the signature was produced by {@link #address()} over {@link #digest()}
     */
    public boolean verify() {
        try {
            return PrivateKey.recoverAddress(digest.bytes(), signature).equals(address);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @return the JSON form
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise signed digest", e);
        }
    }

    /**
     * Parses the JSON form.
     *
     * @param json the JSON string
     * @return the parsed result
     * @throws IllegalArgumentException if the JSON is invalid or null
     */
    public static SignedDigest fromJson(final String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, SignedDigest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid signed digest JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SignedDigest other)) {
            return false;
        }
        return digest.equals(other.digest)
                && address.equals(other.address)
                && signature.equals(other.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(digest, address, signature);
    }

    @Override
    public String toString() {
        return "SignedDigest{digest=" + digestHex() + ", signer=" + signerHex() + ", signature=" + signatureHex() + '}';
    }
}
