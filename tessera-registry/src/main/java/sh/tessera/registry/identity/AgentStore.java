// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * State owned by the Identity Registry. Only the registry mutates it, always inside
 * a ledger transaction.
 */
public final class AgentStore {

    private final Map<AgentId, AgentRecord> agents = new LinkedHashMap<>();
    private final Map<AgentId, Map<String, byte[]>> metadata = new HashMap<>();
    private final Map<AgentId, Address> approvals = new HashMap<>();
    private final Map<Address, Set<Address>> operators = new HashMap<>();
    private final Map<Address, Set<AgentId>> owned = new HashMap<>();
    private final Map<AgentId, BigInteger> walletNonces = new HashMap<>();
    private long nextId = 1;

    AgentId nextAgentId() {
        return AgentId.of(nextId);
    }

    void mint(final AgentRecord record) {
        if (!record.agentId().equals(nextAgentId())) {
            throw new IllegalStateException("expected " + nextAgentId() + ", got " + record.agentId());
        }
        agents.put(record.agentId(), record);
        owned.computeIfAbsent(record.owner(), k -> new LinkedHashSet<>()).add(record.agentId());
        nextId++;
    }

    Optional<AgentRecord> get(final AgentId agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    void update(final AgentRecord record) {
        final AgentRecord previous = agents.put(record.agentId(), record);
        if (previous != null && !previous.owner().equals(record.owner())) {
            owned.get(previous.owner()).remove(record.agentId());
            owned.computeIfAbsent(record.owner(), k -> new LinkedHashSet<>()).add(record.agentId());
        }
    }

    long size() {
        return agents.size();
    }

    List<AgentId> ownedBy(final Address owner) {
        return List.copyOf(owned.getOrDefault(owner, Set.of()));
    }

    Optional<byte[]> metadata(final AgentId agentId, final String key) {
        final byte[] value = metadata.getOrDefault(agentId, Map.of()).get(key);
        return value == null ? Optional.empty() : Optional.of(Arrays.copyOf(value, value.length));
    }

    void putMetadata(final AgentId agentId, final String key, final byte[] value) {
        metadata.computeIfAbsent(agentId, k -> new HashMap<>()).put(key, Arrays.copyOf(value, value.length));
    }

    Optional<Address> approval(final AgentId agentId) {
        return Optional.ofNullable(approvals.get(agentId));
    }

    void setApproval(final AgentId agentId, final Address approved) {
        if (approved.isZero()) {
            approvals.remove(agentId);
        } else {
            approvals.put(agentId, approved);
        }
    }

    boolean isOperator(final Address owner, final Address operator) {
        return operators.getOrDefault(owner, Set.of()).contains(operator);
    }

    void setOperator(final Address owner, final Address operator, final boolean approved) {
        if (approved) {
            operators.computeIfAbsent(owner, k -> new HashSet<>()).add(operator);
        } else {
            final Set<Address> granted = operators.get(owner);
            if (granted != null) {
                granted.remove(operator);
            }
        }
    }

    BigInteger walletNonce(final AgentId agentId) {
        return walletNonces.getOrDefault(agentId, BigInteger.ZERO);
    }

    void consumeWalletNonce(final AgentId agentId) {
        walletNonces.merge(agentId, BigInteger.ONE, BigInteger::add);
    }
}
