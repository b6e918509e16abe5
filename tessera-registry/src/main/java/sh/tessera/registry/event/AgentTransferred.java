// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * Ownership of an agent moved from one address to another.
 *
 * @param agentId the agent
 * @param from    previous owner
 * @param to      new owner
 */
public record AgentTransferred(AgentId agentId, Address from, Address to) implements LedgerEvent {
}
