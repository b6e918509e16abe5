// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import java.math.BigInteger;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * A delegated wallet was bound after its proof of control verified.
 *
 * @param agentId the agent
 * @param wallet  the bound wallet
 * @param nonce   the binding nonce that was consumed
 * @param setBy   the caller
 */
public record AgentWalletSet(AgentId agentId, Address wallet, BigInteger nonce, Address setBy)
        implements LedgerEvent {
}
