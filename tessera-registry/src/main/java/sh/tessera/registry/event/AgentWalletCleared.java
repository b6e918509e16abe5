// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * A delegated wallet was removed, either explicitly or by an ownership transfer.
 *
 * @param agentId        the agent
 * @param previousWallet the wallet that was cleared
 * @param clearedBy      the caller of the clearing operation
 */
public record AgentWalletCleared(AgentId agentId, Address previousWallet, Address clearedBy)
        implements LedgerEvent {
}
