// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Thrown when a digest does not decode to the accepted fixed length.
 *
 * <p>{@link #actual()} is always the decoded byte length, never the length of the
 * text the bytes were decoded from.
 *
 * @since 0.1.0
 */
public final class DigestLengthException extends InputException {

    private final int expected;
    private final int actual;

    public DigestLengthException(final int expected, final int actual) {
        super(Kind.DIGEST_LENGTH, "Expected a %d-byte digest, got %d bytes".formatted(expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
