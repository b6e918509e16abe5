// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.registry.incident.IncidentId;
import sh.tessera.registry.incident.ResolutionCode;

/**
 * The original reporter closed an incident.
 *
 * @param incidentId the incident
 * @param agentId    the agent
 * @param resolver   the reporter
 * @param resolution the resolution code
 * @param timestamp  time in unix seconds
 */
public record IncidentResolved(
        IncidentId incidentId,
        AgentId agentId,
        Address resolver,
        ResolutionCode resolution,
        long timestamp) implements LedgerEvent {
}
