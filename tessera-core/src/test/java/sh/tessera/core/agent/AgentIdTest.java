// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.agent;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class AgentIdTest {

    @Test
    void of_createsFromLong() {
        assertEquals(BigInteger.valueOf(42), AgentId.of(42).value());
    }

    @Test
    void constructor_rejectsNull() {
        assertThrows(NullPointerException.class, () -> new AgentId(null));
    }

    @Test
    void of_rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> AgentId.of(-1));
    }

    @Test
    void equality() {
        assertEquals(AgentId.of(7), AgentId.of(7));
        assertNotEquals(AgentId.of(7), AgentId.of(8));
    }

    @Test
    void toString_includesValue() {
        assertEquals("AgentId(42)", AgentId.of(42).toString());
    }
}
