// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    void decodesWithAndWithoutPrefix() {
        assertArrayEquals(new byte[] {0x12, (byte) 0xab}, Hex.decode("0x12ab"));
        assertArrayEquals(new byte[] {0x12, (byte) 0xab}, Hex.decode("12AB"));
    }

    @Test
    void decodesEmpty() {
        assertEquals(0, Hex.decode("0x").length);
        assertEquals(0, Hex.decode("").length);
    }

    @Test
    void rejectsOddLength() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x123"));
    }

    @Test
    void rejectsInvalidCharacter() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xzz"));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }

    @Test
    void encodesLowercaseWithPrefix() {
        assertEquals("0x00ff7f", Hex.encode(new byte[] {0x00, (byte) 0xff, 0x7f}));
        assertEquals("00ff7f", Hex.encodeNoPrefix(new byte[] {0x00, (byte) 0xff, 0x7f}));
    }

    @Test
    void cleanPrefixStripsOnlyLeadingPrefix() {
        assertEquals("abcd", Hex.cleanPrefix("0xabcd"));
        assertEquals("abcd", Hex.cleanPrefix("abcd"));
        assertTrue(Hex.hasPrefix("0Xab"));
        assertFalse(Hex.hasPrefix("x0ab"));
    }
}
