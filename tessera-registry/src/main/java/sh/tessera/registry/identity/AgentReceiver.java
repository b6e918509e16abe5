// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * Code hosted at an address that must acknowledge incoming safe transfers.
 * Addresses without a receiver accept safe transfers unconditionally.
 *
 * @see sh.tessera.registry.Ledger#installReceiver
 */
@FunctionalInterface
public interface AgentReceiver {

    /**
     * Called before a safe transfer to the hosting address takes effect. The
     * receiver may query the registries; a mutating call from it fails with
     * {@code REENTRANT_CALL} and aborts the transfer.
     *
     * @param operator the caller of the transfer
     * @param from     the current owner
     * @param agentId  the agent being transferred
     * @param data     opaque data passed by the caller
     * @return true to accept the agent
     */
    boolean onAgentReceived(Address operator, Address from, AgentId agentId, byte[] data);
}
