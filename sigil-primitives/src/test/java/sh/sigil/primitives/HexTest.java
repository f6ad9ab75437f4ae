// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    @DisplayName("Encoding empty and single bytes")
    void testEncodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void testEncodeMultipleBytes() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0x0123abcd", Hex.encode(bytes));
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
    }

    @Test
    void testDecodeCaseInsensitivity() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
    }

    @Test
    void testDecodeEmpty() {
        assertArrayEquals(new byte[0], Hex.decode("0x"));
        assertArrayEquals(new byte[0], Hex.decode(""));
    }

    @Test
    void testDecodeRejectsOddLength() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x123"));
    }

    @Test
    void testDecodeErrorDoesNotEchoInput() {
        String secretish = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ffzz";
        var ex = assertThrows(IllegalArgumentException.class, () -> Hex.decode(secretish));
        assertFalse(ex.getMessage().contains("ac0974"));
        assertTrue(ex.getMessage().contains("position 64"));
    }

    @Test
    void testDecodeRejectsNonAscii() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xéé"));
    }

    @Test
    void testCleanPrefix() {
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
    }

    @Test
    void testHasPrefix() {
        assertTrue(Hex.hasPrefix("0x1"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void testIsValid() {
        assertTrue(Hex.isValid("0xdeadBEEF"));
        assertTrue(Hex.isValid(""));
        assertFalse(Hex.isValid("0xabc"));
        assertFalse(Hex.isValid("0xgg"));
        assertFalse(Hex.isValid(null));
    }
}
