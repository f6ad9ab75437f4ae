// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.sigil.primitives.Hex;

class Keccak256Test {

    @Test
    void hashesEmptyInput() {
        assertEquals(
                "0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void hashesHello() {
        assertEquals(
                "0x1c8aff950685c2ed4bc3174f3472287b56d9517b9c948127319a09a7a36deac8",
                Hex.encode(Keccak256.hash("hello".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void multiArrayHashEqualsHashOfConcatenation() {
        final byte[] a = "hel".getBytes(StandardCharsets.UTF_8);
        final byte[] b = "lo".getBytes(StandardCharsets.UTF_8);
        assertEquals(
                Hex.encode(Keccak256.hash("hello".getBytes(StandardCharsets.UTF_8))),
                Hex.encode(Keccak256.hash(a, b)));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> Keccak256.hash((byte[]) null));
    }
}
