// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsPrivateKeys() {
        String out = LogSanitizer.sanitize("{\"privateKey\": \"0xac0974bec39a17e36ba4a6b4d238ff944bacb478\"}");
        assertEquals("{\"privateKey\":\"0x***[REDACTED]***\"}", out);
    }

    @Test
    void redactsSignatures() {
        String out = LogSanitizer.sanitize("bind {\"signature\":\"0x1234\",\"agentId\":1}");
        assertEquals("bind {\"signature\":\"0x***[REDACTED]***\",\"agentId\":1}", out);
    }

    @Test
    void truncatesLongPayloads() {
        String out = LogSanitizer.sanitize("x".repeat(5000));
        assertEquals(2000, out.length());
        assertTrue(out.endsWith("...(truncated)"));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void leavesOrdinaryTextAlone() {
        assertEquals("register owner=0x1", LogSanitizer.sanitize("register owner=0x1"));
    }
}
