// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import static org.junit.jupiter.api.Assertions.*;
import static sh.tessera.registry.TestLedgers.BUYER;
import static sh.tessera.registry.TestLedgers.CLIENT;
import static sh.tessera.registry.TestLedgers.NOW;
import static sh.tessera.registry.TestLedgers.OWNER;
import static sh.tessera.registry.TestLedgers.STRANGER;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.crypto.PrivateKeySigner;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.RegistryError;
import sh.tessera.core.error.UnauthorizedException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.event.LedgerEvent;
import sh.tessera.registry.identity.WalletBindings;
import sh.tessera.registry.incident.IncidentId;
import sh.tessera.registry.incident.IncidentStatus;
import sh.tessera.registry.incident.ResolutionCode;
import sh.tessera.registry.reputation.Sentiment;
import sh.tessera.registry.validation.ValidationRegistry;
import sh.tessera.registry.validation.ValidationSummary;

/**
 * End-to-end flows across all four registries on one ledger.
 */
class TrustRegistriesScenarioTest {

    private static final Address VALIDATOR = new Address("0x" + "7".repeat(40));

    private TrustRegistries registries;
    private final List<LedgerEvent> published = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registries = TrustRegistries.deploy(TestLedgers.config());
        registries.ledger().addListener(published::add);
    }

    @Test
    void transferredAgentLosesDelegatedWallet() {
        PrivateKeySigner wallet = new PrivateKeySigner(TestLedgers.WALLET_KEY);
        AgentId agent = registries.identity().register(OWNER, "https://agents.example/a.json");
        var binding = WalletBindings.binding(agent, wallet.address(), registries.identity().walletNonce(agent),
                NOW + 600);
        registries.identity().setAgentWallet(OWNER, agent, wallet.address(), NOW + 600,
                WalletBindings.sign(binding, registries.identity().walletBindingDomain(), wallet));

        assertEquals(RegistryError.SELF_FEEDBACK, assertThrows(UnauthorizedException.class,
                () -> registries.reputation().submitFeedback(wallet.address(), agent, "me", Sentiment.POSITIVE))
                .error());
        assertEquals(0, registries.reputation().submitFeedback(CLIENT, agent, "great agent", Sentiment.POSITIVE));

        registries.identity().transferFrom(OWNER, OWNER, BUYER, agent);

        assertEquals(Address.ZERO, registries.identity().agentWallet(agent));
        assertEquals(BUYER, registries.identity().ownerOf(agent));
        assertEquals(1, registries.reputation().summary(agent).positive());
        assertEquals(registries.ledger().eventLog().events(), published);
    }

    @Test
    void repeatedValidationRequestsGetDistinctIds() {
        AgentId agent = registries.identity().register(OWNER);
        Hash content = new Hash("0x" + "c0".repeat(32));
        ValidationRegistry validation = registries.validation();

        Hash first = validation.requestValidation(CLIENT, VALIDATOR, agent, "ipfs://req", content);
        Hash second = validation.requestValidation(CLIENT, VALIDATOR, agent, "ipfs://req", content);
        assertNotEquals(first, second);

        validation.complete(VALIDATOR, first, "ipfs://ok", null);
        validation.reject(VALIDATOR, second, "ipfs://no", null);

        ValidationSummary summary = validation.summary(agent);
        assertEquals(1, summary.completed());
        assertEquals(1, summary.rejected());
        assertEquals(0, summary.pending());
        assertEquals(Integer.valueOf(ValidationRegistry.DEFAULT_COMPLETION_OUTCOME),
                validation.request(first).outcome());
        assertEquals(Integer.valueOf(ValidationRegistry.DEFAULT_REJECTION_OUTCOME),
                validation.request(second).outcome());
    }

    @Test
    void incidentIsResolvedOnlyByReporter() {
        AgentId agent = registries.identity().register(OWNER);
        IncidentId id = registries.incident().report(CLIENT, agent, "hallucination", "ipfs://log", null);
        registries.incident().respond(OWNER, id, "ipfs://reply", null);

        assertThrows(UnauthorizedException.class,
                () -> registries.incident().resolve(STRANGER, id, ResolutionCode.FIXED));
        registries.incident().resolve(CLIENT, id, ResolutionCode.FIXED);

        assertEquals(IncidentStatus.RESOLVED, registries.incident().incident(id).status());
    }

    @Test
    void fullThreadRejectsOneMoreResponse() {
        int max = registries.ledger().limits().maxResponses();
        AgentId agent = registries.identity().register(OWNER);
        registries.reputation().submitFeedback(CLIENT, agent, "slow", Sentiment.NEGATIVE);
        for (int i = 0; i < max; i++) {
            registries.reputation().appendResponse(OWNER, agent, 0, "reply " + i, null, null);
        }
        int eventsBefore = published.size();

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> registries.reputation().appendResponse(OWNER, agent, 0, "one more", null, null));

        assertEquals(RegistryError.THREAD_FULL, e.error());
        assertEquals(max, registries.reputation().responseCount(agent, 0));
        assertEquals(eventsBefore, published.size());
    }

    @Test
    void registriesShareOneClockAndLog() {
        AgentId agent = registries.identity().register(OWNER);
        registries.reputation().submitFeedback(CLIENT, agent, "ok", Sentiment.NEUTRAL);
        registries.incident().report(CLIENT, agent, "spam", null, null);

        assertEquals(3, registries.ledger().eventLog().size());
        assertEquals(NOW, registries.identity().agent(agent).registeredAt());
        assertEquals(NOW, registries.reputation().feedback(agent, 0).createdAt());
    }
}
