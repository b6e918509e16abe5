// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * Incidents by id with per-agent and per-reporter id lists.
 */
public final class IncidentStore {

    private final Map<IncidentId, Incident> incidents = new HashMap<>();
    private final Map<AgentId, List<IncidentId>> byAgent = new HashMap<>();
    private final Map<Address, List<IncidentId>> byReporter = new HashMap<>();
    private long nextId = 1;

    IncidentId nextIncidentId() {
        return IncidentId.of(nextId);
    }

    void insert(final Incident incident) {
        if (!incident.incidentId().equals(nextIncidentId())) {
            throw new IllegalStateException("expected " + nextIncidentId() + ", got " + incident.incidentId());
        }
        incidents.put(incident.incidentId(), incident);
        byAgent.computeIfAbsent(incident.agentId(), k -> new ArrayList<>()).add(incident.incidentId());
        byReporter.computeIfAbsent(incident.reporter(), k -> new ArrayList<>()).add(incident.incidentId());
        nextId++;
    }

    void replace(final Incident incident) {
        incidents.put(incident.incidentId(), incident);
    }

    Optional<Incident> get(final IncidentId incidentId) {
        return Optional.ofNullable(incidents.get(incidentId));
    }

    List<IncidentId> idsByAgent(final AgentId agentId) {
        return List.copyOf(byAgent.getOrDefault(agentId, List.of()));
    }

    List<IncidentId> idsByReporter(final Address reporter) {
        return List.copyOf(byReporter.getOrDefault(reporter, List.of()));
    }
}
