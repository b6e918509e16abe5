// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.registry.identity.AgentStore;
import sh.tessera.registry.identity.ControlProofVerifier;
import sh.tessera.registry.identity.Eip712ControlProofVerifier;
import sh.tessera.registry.identity.IdentityRegistry;
import sh.tessera.registry.incident.IncidentRegistry;
import sh.tessera.registry.reputation.ReputationRegistry;
import sh.tessera.registry.validation.ValidationRegistry;

/**
 * The four registries deployed on one {@link Ledger}, wired the only way they may be:
 * Reputation, Validation and Incident read from Identity, and Identity reads from none
 * of them.
 *
 * <p>Example:
 * <pre>{@code
 * TrustRegistries registries = TrustRegistries.deploy(LedgerProfiles.local());
 * AgentId agent = registries.identity().register(owner, "https://agents.example/alpha.json");
 * registries.reputation().submitFeedback(client, agent, "great agent", Sentiment.POSITIVE);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class TrustRegistries {

    private static final Logger log = LoggerFactory.getLogger(TrustRegistries.class);

    private final Ledger ledger;
    private final IdentityRegistry identity;
    private final ReputationRegistry reputation;
    private final ValidationRegistry validation;
    private final IncidentRegistry incident;

    private TrustRegistries(final Ledger ledger, final IdentityRegistry identity) {
        this.ledger = ledger;
        this.identity = identity;
        this.reputation = new ReputationRegistry(ledger, identity);
        this.validation = new ValidationRegistry(ledger, identity);
        this.incident = new IncidentRegistry(ledger, identity);
    }

    /**
     * Creates a ledger for {@code config} and deploys all four registries on it.
     *
     * @param config deployment settings
     * @return the deployed registries
     */
    public static TrustRegistries deploy(final LedgerConfig config) {
        Objects.requireNonNull(config, "config");
        return deploy(new Ledger(config));
    }

    /**
     * Deploys the registries on an existing ledger with the default wallet proof verifier.
     */
    public static TrustRegistries deploy(final Ledger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        return deploy(ledger, new Eip712ControlProofVerifier());
    }

    /**
     * Deploys the registries on an existing ledger with a custom wallet proof verifier.
     */
    public static TrustRegistries deploy(final Ledger ledger, final ControlProofVerifier verifier) {
        Objects.requireNonNull(ledger, "ledger");
        Objects.requireNonNull(verifier, "verifier");
        final TrustRegistries registries =
                new TrustRegistries(ledger, new IdentityRegistry(ledger, new AgentStore(), verifier));
        final LedgerConfig config = ledger.config();
        log.info("Deployed registries on chain {}: identity={} reputation={} validation={} incident={}",
                config.chainId(), config.identityAddress(), config.reputationAddress(),
                config.validationAddress(), config.incidentAddress());
        return registries;
    }

    public Ledger ledger() {
        return ledger;
    }

    public IdentityRegistry identity() {
        return identity;
    }

    public ReputationRegistry reputation() {
        return reputation;
    }

    public ValidationRegistry validation() {
        return validation;
    }

    public IncidentRegistry incident() {
        return incident;
    }
}
