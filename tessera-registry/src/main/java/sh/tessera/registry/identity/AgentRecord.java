// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Snapshot of an agent identity. Updates replace the record with a modified copy.
 *
 * @param agentId      the id, fixed at mint
 * @param owner        current owner, never zero
 * @param agentUri     pointer to the off-chain registration document
 * @param metadataHash integrity hash of that document, or null
 * @param wallet       delegated wallet, or null
 * @param active       lifecycle flag
 * @param registeredAt mint time in unix seconds
 * @since 0.1.0
 */
public record AgentRecord(
        AgentId agentId,
        Address owner,
        String agentUri,
        @Nullable Hash metadataHash,
        @Nullable Address wallet,
        boolean active,
        long registeredAt) {

    public AgentRecord {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(agentUri, "agentUri");
    }

    public Optional<Address> walletAddress() {
        return Optional.ofNullable(wallet);
    }

    AgentRecord withOwner(final Address newOwner) {
        return new AgentRecord(agentId, newOwner, agentUri, metadataHash, null, active, registeredAt);
    }

    AgentRecord withUri(final String uri, final @Nullable Hash hash) {
        return new AgentRecord(agentId, owner, uri, hash, wallet, active, registeredAt);
    }

    AgentRecord withWallet(final @Nullable Address newWallet) {
        return new AgentRecord(agentId, owner, agentUri, metadataHash, newWallet, active, registeredAt);
    }

    AgentRecord withActive(final boolean flag) {
        return new AgentRecord(agentId, owner, agentUri, metadataHash, wallet, flag, registeredAt);
    }
}
