// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * The single approved transfer address of an agent changed.
 * {@code approved} is the zero address when the approval was revoked.
 *
 * @param agentId  the agent
 * @param owner    the owner at the time of approval
 * @param approved the approved address
 */
public record AgentApproval(AgentId agentId, Address owner, Address approved) implements LedgerEvent {
}
