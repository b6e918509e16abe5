// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.incident.IncidentId;

/**
 * An incident was opened against an agent.
 *
 * @param incidentId the assigned id
 * @param agentId    the agent
 * @param reporter   the caller
 * @param category   incident category
 * @param reportUri  evidence reference, possibly empty
 * @param reportHash evidence hash, or null
 * @param timestamp  time in unix seconds
 */
public record IncidentReported(
        IncidentId incidentId,
        AgentId agentId,
        Address reporter,
        String category,
        String reportUri,
        @Nullable Hash reportHash,
        long timestamp) implements LedgerEvent {
}
