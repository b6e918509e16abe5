// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.agent.AgentId;
import sh.tessera.core.error.InvalidInputException;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.NotFoundException;
import sh.tessera.core.error.UnauthorizedException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.Ledger;
import sh.tessera.registry.RegistryLimits;
import sh.tessera.registry.event.IncidentReported;
import sh.tessera.registry.event.IncidentResolved;
import sh.tessera.registry.event.IncidentResponded;
import sh.tessera.registry.identity.AgentDirectory;

import static sh.tessera.registry.RegistryChecks.requireCaller;
import static sh.tessera.registry.RegistryChecks.requireMaxLength;
import static sh.tessera.registry.RegistryChecks.requireText;

/**
 * Reports about an agent's behavior, with one response and one resolution each.
 *
 * <p>State machine: {@code OPEN -> RESPONDED -> RESOLVED}. The agent's owner or
 * delegate responds while the incident is open; the original reporter resolves it
 * after the response.
 *
 * @since 0.1.0
 */
public final class IncidentRegistry {

    private static final Logger log = LoggerFactory.getLogger(IncidentRegistry.class);

    private final Ledger ledger;
    private final AgentDirectory directory;
    private final IncidentStore store;

    public IncidentRegistry(final Ledger ledger, final AgentDirectory directory, final IncidentStore store) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.store = Objects.requireNonNull(store, "store");
    }

    public IncidentRegistry(final Ledger ledger, final AgentDirectory directory) {
        this(ledger, directory, new IncidentStore());
    }

    public Address address() {
        return ledger.config().incidentAddress();
    }

    /**
     * Opens an incident against an agent.
     *
     * @param caller     the reporter
     * @param agentId    the agent
     * @param category   non-empty category
     * @param reportUri  evidence reference
     * @param reportHash evidence hash, or null
     * @return the new incident id
     */
    public IncidentId report(final Address caller, final AgentId agentId, final String category,
                             final @Nullable String reportUri, final @Nullable Hash reportHash) {
        requireCaller(caller);
        Objects.requireNonNull(agentId, "agentId");
        final RegistryLimits limits = ledger.limits();
        final String kind = requireText(category, limits.maxTagLength(), "category");
        final String uri = requireMaxLength(reportUri, limits.maxUriLength(), "reportUri");

        return ledger.transact("incident.report", () -> {
            requireAgent(agentId);
            final IncidentId incidentId = store.nextIncidentId();
            store.insert(new Incident(incidentId, agentId, caller, kind, uri, reportHash, ledger.timestamp(),
                    IncidentStatus.OPEN, null, "", null, 0L, ResolutionCode.NONE, 0L));
            ledger.emit(new IncidentReported(incidentId, agentId, caller, kind, uri, reportHash,
                    ledger.timestamp()));
            log.debug("{} reported against {} by {}", incidentId, agentId, caller);
            DebugLogger.logOperation("[INCIDENT] id=%s agent=%s category=%s", incidentId, agentId, kind);
            return incidentId;
        });
    }

    public void respond(final Address caller, final IncidentId incidentId, final @Nullable String responseUri,
                        final @Nullable Hash responseHash) {
        requireCaller(caller);
        final String uri = requireMaxLength(responseUri, ledger.limits().maxUriLength(), "responseUri");
        ledger.execute("incident.respond", () -> {
            final Incident incident = requireIncident(incidentId);
            requireStatus(incident, IncidentStatus.OPEN);
            if (!directory.isAuthority(incident.agentId(), caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the owner or delegate of " + incident.agentId());
            }
            store.replace(incident.respond(caller, uri, responseHash, ledger.timestamp()));
            ledger.emit(new IncidentResponded(incidentId, incident.agentId(), caller, uri, responseHash,
                    ledger.timestamp()));
        });
    }

    /**
     * Closes a responded incident.
     *
     * @throws InvalidInputException if {@code resolution} is {@link ResolutionCode#NONE}
     */
    public void resolve(final Address caller, final IncidentId incidentId, final ResolutionCode resolution) {
        requireCaller(caller);
        Objects.requireNonNull(resolution, "resolution");
        if (resolution == ResolutionCode.NONE) {
            throw InvalidInputException.outOfRange("resolution", resolution, "ResolutionCode other than NONE");
        }
        ledger.execute("incident.resolve", () -> {
            final Incident incident = requireIncident(incidentId);
            if (!incident.reporter().equals(caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the reporter of " + incidentId);
            }
            requireStatus(incident, IncidentStatus.RESPONDED);
            store.replace(incident.resolve(resolution, ledger.timestamp()));
            ledger.emit(new IncidentResolved(incidentId, incident.agentId(), caller, resolution,
                    ledger.timestamp()));
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════

    public Incident incident(final IncidentId incidentId) {
        return ledger.read(() -> requireIncident(incidentId));
    }

    public List<IncidentId> incidentsByAgent(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            return store.idsByAgent(agentId);
        });
    }

    public List<IncidentId> incidentsByReporter(final Address reporter) {
        Objects.requireNonNull(reporter, "reporter");
        return ledger.read(() -> store.idsByReporter(reporter));
    }

    public long incidentCount(final AgentId agentId) {
        return incidentsByAgent(agentId).size();
    }

    public IncidentSummary summary(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            long open = 0;
            long responded = 0;
            long resolved = 0;
            for (IncidentId id : store.idsByAgent(agentId)) {
                switch (store.get(id).orElseThrow().status()) {
                    case OPEN -> open++;
                    case RESPONDED -> responded++;
                    case RESOLVED -> resolved++;
                }
            }
            return new IncidentSummary(open + responded + resolved, open, responded, resolved);
        });
    }

    private void requireAgent(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        if (!directory.exists(agentId)) {
            throw NotFoundException.agent(agentId);
        }
    }

    private Incident requireIncident(final IncidentId incidentId) {
        Objects.requireNonNull(incidentId, "incidentId");
        return store.get(incidentId).orElseThrow(() -> NotFoundException.incident(incidentId));
    }

    private static void requireStatus(final Incident incident, final IncidentStatus required) {
        if (incident.status() != required) {
            throw InvalidStateException.status(incident.incidentId(), incident.status(), required);
        }
    }
}
