// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.incident.IncidentId;

public record IncidentResponded(
        IncidentId incidentId,
        AgentId agentId,
        Address responder,
        String responseUri,
        @Nullable Hash responseHash,
        long timestamp) implements LedgerEvent {
}
