// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.util.Optional;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * Read-only view of who controls each agent.
 *
 * <p>Implemented by {@link IdentityRegistry} and handed to the Reputation, Validation
 * and Incident registries, which consult it before mutating their own state and never
 * write through it.
 *
 * <p>Every method except {@link #exists} throws
 * {@link sh.tessera.core.error.NotFoundException} for an unknown agent.
 *
 * @since 0.1.0
 */
public interface AgentDirectory {

    boolean exists(AgentId agentId);

    Address ownerOf(AgentId agentId);

    /**
     * Returns the agent's delegated wallet.
     *
     * @param agentId the agent
     * @return the wallet, or empty when none is bound
     */
    Optional<Address> delegateOf(AgentId agentId);

    boolean isActive(AgentId agentId);

    /**
     * Returns whether an address currently speaks for an agent: it is the owner
     * or the delegated wallet.
     *
     * @param agentId the agent
     * @param address the address to test
     * @return true for the owner or the delegate
     */
    boolean isAuthority(AgentId agentId, Address address);
}
