// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * An agent's URI (and optionally the integrity hash of its document) changed.
 *
 * @param agentId      the agent
 * @param agentUri     the new URI
 * @param metadataHash the new document hash, or null when the update carried none
 * @param updatedBy    the caller
 */
public record AgentUriUpdated(AgentId agentId, String agentUri, @Nullable Hash metadataHash, Address updatedBy)
        implements LedgerEvent {
}
