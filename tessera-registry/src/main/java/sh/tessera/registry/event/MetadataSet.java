// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * A metadata entry was written.
 *
 * @param agentId   the agent
 * @param key       the metadata key
 * @param value     the stored bytes as 0x-prefixed hex
 * @param updatedBy the caller
 */
public record MetadataSet(AgentId agentId, String key, String value, Address updatedBy)
        implements LedgerEvent {
}
