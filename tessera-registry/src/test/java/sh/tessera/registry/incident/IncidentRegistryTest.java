// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static sh.tessera.registry.TestLedgers.CLIENT;
import static sh.tessera.registry.TestLedgers.NOW;
import static sh.tessera.registry.TestLedgers.OWNER;
import static sh.tessera.registry.TestLedgers.STRANGER;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.error.InvalidInputException;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.NotFoundException;
import sh.tessera.core.error.RegistryError;
import sh.tessera.core.error.UnauthorizedException;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.Ledger;
import sh.tessera.registry.TestLedgers;
import sh.tessera.registry.event.IncidentReported;
import sh.tessera.registry.event.IncidentResolved;
import sh.tessera.registry.event.IncidentResponded;
import sh.tessera.registry.identity.AgentDirectory;

@ExtendWith(MockitoExtension.class)
class IncidentRegistryTest {

    private static final AgentId AGENT = AgentId.of(1);
    private static final Hash EVIDENCE = new Hash("0x" + "5e".repeat(32));

    @Mock
    private AgentDirectory directory;

    private Ledger ledger;
    private IncidentRegistry incidents;

    @BeforeEach
    void setUp() {
        ledger = TestLedgers.ledger();
        incidents = new IncidentRegistry(ledger, directory);
    }

    @Test
    void reportOpensIncidentWithSequentialIds() {
        when(directory.exists(AGENT)).thenReturn(true);

        IncidentId first = incidents.report(CLIENT, AGENT, "data-leak", "ipfs://evidence", EVIDENCE);
        IncidentId second = incidents.report(STRANGER, AGENT, "downtime", null, null);

        assertEquals(IncidentId.of(1), first);
        assertEquals(IncidentId.of(2), second);
        Incident incident = incidents.incident(first);
        assertEquals(IncidentStatus.OPEN, incident.status());
        assertEquals(CLIENT, incident.reporter());
        assertEquals(ResolutionCode.NONE, incident.resolution());
        assertNull(incident.responder());
        assertEquals("", incidents.incident(second).reportUri());
        assertEquals(new IncidentReported(first, AGENT, CLIENT, "data-leak", "ipfs://evidence", EVIDENCE, NOW),
                ledger.eventLog().eventsOfType(IncidentReported.class).get(0));
    }

    @Test
    void categoryIsRequired() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> incidents.report(CLIENT, AGENT, "", null, null));
        assertEquals(RegistryError.EMPTY_FIELD, e.error());
        verifyNoInteractions(directory);
    }

    @Test
    void unknownAgentCannotBeReported() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> incidents.report(CLIENT, AGENT, "spam", null, null));
        assertEquals(RegistryError.AGENT_NOT_FOUND, e.error());
        assertEquals(0, ledger.eventLog().size());
    }

    @Test
    void fullLifecycle() {
        when(directory.exists(AGENT)).thenReturn(true);
        when(directory.isAuthority(AGENT, OWNER)).thenReturn(true);
        IncidentId id = incidents.report(CLIENT, AGENT, "wrong-answer", "ipfs://evidence", EVIDENCE);

        incidents.respond(OWNER, id, "ipfs://postmortem", null);
        Incident responded = incidents.incident(id);
        assertEquals(IncidentStatus.RESPONDED, responded.status());
        assertEquals(OWNER, responded.responder());
        assertEquals("ipfs://postmortem", responded.responseUri());

        incidents.resolve(CLIENT, id, ResolutionCode.FIXED);
        Incident resolved = incidents.incident(id);
        assertEquals(IncidentStatus.RESOLVED, resolved.status());
        assertEquals(ResolutionCode.FIXED, resolved.resolution());
        assertEquals(NOW, resolved.resolvedAt());

        assertEquals(List.of(new IncidentResponded(id, AGENT, OWNER, "ipfs://postmortem", null, NOW)),
                ledger.eventLog().eventsOfType(IncidentResponded.class));
        assertEquals(List.of(new IncidentResolved(id, AGENT, CLIENT, ResolutionCode.FIXED, NOW)),
                ledger.eventLog().eventsOfType(IncidentResolved.class));
    }

    @Test
    void onlyAgentAuthorityResponds() {
        when(directory.exists(AGENT)).thenReturn(true);
        IncidentId id = incidents.report(CLIENT, AGENT, "spam", null, null);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> incidents.respond(STRANGER, id, null, null));

        assertEquals(RegistryError.NOT_AUTHORIZED, e.error());
        assertEquals(IncidentStatus.OPEN, incidents.incident(id).status());
    }

    @Test
    void secondResponseIsRejected() {
        when(directory.exists(AGENT)).thenReturn(true);
        when(directory.isAuthority(AGENT, OWNER)).thenReturn(true);
        IncidentId id = incidents.report(CLIENT, AGENT, "spam", null, null);
        incidents.respond(OWNER, id, null, null);

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> incidents.respond(OWNER, id, "again", null));
        assertEquals(RegistryError.INVALID_STATUS, e.error());
    }

    @Test
    void resolveRequiresReporterAndResponse() {
        when(directory.exists(AGENT)).thenReturn(true);
        when(directory.isAuthority(AGENT, OWNER)).thenReturn(true);
        IncidentId id = incidents.report(CLIENT, AGENT, "spam", null, null);

        assertEquals(RegistryError.INVALID_STATUS, assertThrows(InvalidStateException.class,
                () -> incidents.resolve(CLIENT, id, ResolutionCode.ACKNOWLEDGED)).error());

        incidents.respond(OWNER, id, null, null);
        assertThrows(UnauthorizedException.class, () -> incidents.resolve(OWNER, id, ResolutionCode.NOT_A_BUG));

        incidents.resolve(CLIENT, id, ResolutionCode.DISPUTED);
        assertThrows(InvalidStateException.class, () -> incidents.resolve(CLIENT, id, ResolutionCode.FIXED));
    }

    @Test
    void noneIsNotAResolution() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> incidents.resolve(CLIENT, IncidentId.of(1), ResolutionCode.NONE));
        assertEquals(RegistryError.VALUE_OUT_OF_RANGE, e.error());
    }

    @Test
    void unknownIncidentIsNotFound() {
        assertEquals(RegistryError.INCIDENT_NOT_FOUND, assertThrows(NotFoundException.class,
                () -> incidents.respond(OWNER, IncidentId.of(7), null, null)).error());
    }

    @Test
    void queriesAndSummary() {
        when(directory.exists(AGENT)).thenReturn(true);
        when(directory.isAuthority(AGENT, OWNER)).thenReturn(true);
        IncidentId a = incidents.report(CLIENT, AGENT, "spam", null, null);
        IncidentId b = incidents.report(STRANGER, AGENT, "downtime", null, null);
        IncidentId c = incidents.report(CLIENT, AGENT, "downtime", null, null);
        incidents.respond(OWNER, a, null, null);
        incidents.respond(OWNER, b, null, null);
        incidents.resolve(STRANGER, b, ResolutionCode.DUPLICATE);

        assertEquals(List.of(a, b, c), incidents.incidentsByAgent(AGENT));
        assertEquals(List.of(a, c), incidents.incidentsByReporter(CLIENT));
        assertEquals(3, incidents.incidentCount(AGENT));
        assertEquals(new IncidentSummary(3, 1, 1, 1), incidents.summary(AGENT));
    }
}
