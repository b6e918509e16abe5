// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.agent;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent identifier assigned by the Identity Registry.
 *
 * <p>Ids are minted sequentially starting at 1 and are never reused, so
 * {@code AgentId(0)} never names a live agent.
 *
 * @param value the numeric id (non-negative)
 * @throws NullPointerException     if value is null
 * @throws IllegalArgumentException if value is negative
 */
public record AgentId(@JsonValue BigInteger value) {

    public AgentId {
        Objects.requireNonNull(value, "agentId");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("agentId must be non-negative");
        }
    }

    /**
     * Creates an AgentId from a long value.
     *
     * @param id the agent id
     * @return the agent identifier
     * @throws IllegalArgumentException if id is negative
     */
    public static AgentId of(long id) {
        return new AgentId(BigInteger.valueOf(id));
    }

    @Override
    public String toString() {
        return "AgentId(" + value + ")";
    }
}
