// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * Per-agent feedback lists and author sets owned by the Reputation Registry.
 */
public final class FeedbackStore {

    private final Map<AgentId, List<Feedback>> feedback = new HashMap<>();
    private final Map<AgentId, Set<Address>> authors = new HashMap<>();

    long count(final AgentId agentId) {
        return feedback.getOrDefault(agentId, List.of()).size();
    }

    void append(final Feedback item) {
        feedback.computeIfAbsent(item.agentId(), k -> new ArrayList<>()).add(item);
        authors.computeIfAbsent(item.agentId(), k -> new LinkedHashSet<>()).add(item.author());
    }

    Optional<Feedback> get(final AgentId agentId, final long index) {
        final List<Feedback> items = feedback.getOrDefault(agentId, List.of());
        if (index < 0 || index >= items.size()) {
            return Optional.empty();
        }
        return Optional.of(items.get((int) index));
    }

    void replace(final Feedback item) {
        feedback.get(item.agentId()).set((int) item.index(), item);
    }

    List<Feedback> all(final AgentId agentId) {
        return List.copyOf(feedback.getOrDefault(agentId, List.of()));
    }

    List<Address> authors(final AgentId agentId) {
        return List.copyOf(authors.getOrDefault(agentId, Set.of()));
    }
}
