// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Requests by id plus id lists by agent, validator and requester, and each requester's
 * next sequence number.
 */
public final class ValidationStore {

    private final Map<Hash, ValidationRequest> requests = new HashMap<>();
    private final Map<AgentId, List<Hash>> byAgent = new HashMap<>();
    private final Map<Address, List<Hash>> byValidator = new HashMap<>();
    private final Map<Address, List<Hash>> byRequester = new HashMap<>();
    private final Map<Address, Long> sequences = new HashMap<>();

    long nextSequence(final Address requester) {
        return sequences.getOrDefault(requester, 0L);
    }

    boolean contains(final Hash requestId) {
        return requests.containsKey(requestId);
    }

    void insert(final ValidationRequest request) {
        requests.put(request.requestId(), request);
        byAgent.computeIfAbsent(request.agentId(), k -> new ArrayList<>()).add(request.requestId());
        byValidator.computeIfAbsent(request.validator(), k -> new ArrayList<>()).add(request.requestId());
        byRequester.computeIfAbsent(request.requester(), k -> new ArrayList<>()).add(request.requestId());
        sequences.put(request.requester(), request.sequence() + 1);
    }

    void replace(final ValidationRequest request) {
        requests.put(request.requestId(), request);
    }

    Optional<ValidationRequest> get(final Hash requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    List<Hash> idsByAgent(final AgentId agentId) {
        return List.copyOf(byAgent.getOrDefault(agentId, List.of()));
    }

    List<Hash> idsByValidator(final Address validator) {
        return List.copyOf(byValidator.getOrDefault(validator, List.of()));
    }

    List<Hash> idsByRequester(final Address requester) {
        return List.copyOf(byRequester.getOrDefault(requester, List.of()));
    }
}
