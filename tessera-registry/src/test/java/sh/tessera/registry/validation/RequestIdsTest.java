// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.RegistryId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

class RequestIdsTest {

    private static final Address REQUESTER = new Address("0x" + "a1".repeat(20));
    private static final Address VALIDATOR = new Address("0x" + "b2".repeat(20));
    private static final RegistryId REGISTRY =
            new RegistryId(31337L, new Address("0x8004000000000000000000000000000000000003"));
    private static final Hash CONTENT = new Hash("0x" + "33".repeat(32));

    @Test
    void identicalInputsGiveIdenticalIds() {
        assertEquals(
                RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, 0, REGISTRY),
                RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, 0, REGISTRY));
    }

    @Test
    void everyInputSeparatesIds() {
        Hash base = RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, 0, REGISTRY);

        assertNotEquals(base, RequestIds.requestId(VALIDATOR, VALIDATOR, AgentId.of(1), CONTENT, 0, REGISTRY));
        assertNotEquals(base, RequestIds.requestId(REQUESTER, REQUESTER, AgentId.of(1), CONTENT, 0, REGISTRY));
        assertNotEquals(base, RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(2), CONTENT, 0, REGISTRY));
        assertNotEquals(base, RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), Hash.ZERO, 0, REGISTRY));
        assertNotEquals(base, RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, 1, REGISTRY));
        assertNotEquals(base, RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, 0, new RegistryId(1L, REGISTRY.address())));
        assertNotEquals(base, RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, 0, new RegistryId(31337L, REQUESTER)));
    }

    @Test
    void sequencesNeverCollideForOneRequester() {
        Set<Hash> seen = new HashSet<>();
        for (long sequence = 0; sequence < 500; sequence++) {
            assertTrue(seen.add(RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, sequence,
                    REGISTRY)), "duplicate id at sequence " + sequence);
        }
    }

    @Test
    void defaultContentHashDependsOnUri() {
        Hash first = RequestIds.defaultContentHash(REQUESTER, VALIDATOR, AgentId.of(1), "ipfs://a");

        assertEquals(first, RequestIds.defaultContentHash(REQUESTER, VALIDATOR, AgentId.of(1), "ipfs://a"));
        assertNotEquals(first, RequestIds.defaultContentHash(REQUESTER, VALIDATOR, AgentId.of(1), "ipfs://b"));
        assertFalse(first.isZero());
    }

    @Test
    void negativeSequenceIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RequestIds.requestId(REQUESTER, VALIDATOR, AgentId.of(1), CONTENT, -1, REGISTRY));
    }
}
