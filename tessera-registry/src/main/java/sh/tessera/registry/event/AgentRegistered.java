// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * A new agent identity was minted.
 *
 * @param agentId   the assigned id
 * @param owner     the registering address
 * @param agentUri  the initial URI, possibly empty
 * @param timestamp mint time in unix seconds
 */
public record AgentRegistered(AgentId agentId, Address owner, String agentUri, long timestamp)
        implements LedgerEvent {
}
