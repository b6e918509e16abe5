// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.tessera.primitives.Hex;

/**
 * Keccak-256 against known vectors.
 */
class Keccak256Test {

    @AfterEach
    void cleanup() {
        Keccak256.cleanup();
    }

    @Test
    void emptyInput() {
        assertEquals("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encodeNoPrefix(Keccak256.hash(new byte[0])));
    }

    @Test
    void helloWorld() {
        byte[] hash = Keccak256.hash("hello world".getBytes(StandardCharsets.UTF_8));
        assertEquals("47173285a8d7341e5e972fc677286384f802f8ef42a5ec5f03bbfa254cb01fad", Hex.encodeNoPrefix(hash));
    }

    @Test
    void multipleInputsHashAsConcatenation() {
        byte[] split = Keccak256.hash(
                "hello".getBytes(StandardCharsets.UTF_8),
                " world".getBytes(StandardCharsets.UTF_8));
        byte[] joined = Keccak256.hash("hello world".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals(joined, split);
    }

    @Test
    void digestIsReusableAfterCleanup() {
        byte[] first = Keccak256.hash(new byte[] {1, 2, 3});
        Keccak256.cleanup();
        byte[] second = Keccak256.hash(new byte[] {1, 2, 3});

        assertArrayEquals(first, second);
    }
}
