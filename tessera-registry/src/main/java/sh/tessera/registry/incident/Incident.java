// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * An incident report and its response and resolution, once they exist.
 *
 * @param incidentId   sequential id
 * @param agentId      the agent concerned
 * @param reporter     the reporting address; also the only resolver
 * @param category     incident category
 * @param reportUri    evidence reference, empty when absent
 * @param reportHash   evidence hash
 * @param reportedAt   unix seconds
 * @param status       current state
 * @param responder    owner or delegate that responded, null while open
 * @param responseUri  response reference, empty until responded
 * @param responseHash response hash
 * @param respondedAt  unix seconds, 0 while open
 * @param resolution   {@link ResolutionCode#NONE} until resolved
 * @param resolvedAt   unix seconds, 0 until resolved
 * @since 0.1.0
 */
public record Incident(
        IncidentId incidentId,
        AgentId agentId,
        Address reporter,
        String category,
        String reportUri,
        @Nullable Hash reportHash,
        long reportedAt,
        IncidentStatus status,
        @Nullable Address responder,
        String responseUri,
        @Nullable Hash responseHash,
        long respondedAt,
        ResolutionCode resolution,
        long resolvedAt) {

    public Incident {
        Objects.requireNonNull(incidentId, "incidentId");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(reporter, "reporter");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(reportUri, "reportUri");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(responseUri, "responseUri");
        Objects.requireNonNull(resolution, "resolution");
    }

    Incident respond(final Address by, final String uri, final @Nullable Hash hash, final long timestamp) {
        return new Incident(incidentId, agentId, reporter, category, reportUri, reportHash, reportedAt,
                IncidentStatus.RESPONDED, by, uri, hash, timestamp, ResolutionCode.NONE, 0L);
    }

    Incident resolve(final ResolutionCode code, final long timestamp) {
        return new Incident(incidentId, agentId, reporter, category, reportUri, reportHash, reportedAt,
                IncidentStatus.RESOLVED, responder, responseUri, responseHash, respondedAt, code, timestamp);
    }
}
