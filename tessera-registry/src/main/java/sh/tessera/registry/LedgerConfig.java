// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import sh.tessera.core.agent.RegistryId;
import sh.tessera.core.types.Address;

/**
 * Deployment settings for a {@link Ledger} and the four registries it hosts.
 *
 * <p>
 * <strong>Field constraints:</strong>
 * <ul>
 * <li>{@code chainId} must be positive; it is the execution environment
 * identifier folded into request ids and signing domains</li>
 * <li>the four registry addresses must be non-zero and distinct</li>
 * <li>{@code identityName} and {@code identitySymbol} must be non-blank</li>
 * </ul>
 *
 * <pre>{@code
 * LedgerConfig config = LedgerConfig.builder()
 *         .chainId(31337L)
 *         .clock(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC))
 *         .build();
 * }</pre>
 *
 * @param chainId            execution environment identifier
 * @param identityAddress    address of the Identity Registry
 * @param reputationAddress  address of the Reputation Registry
 * @param validationAddress  address of the Validation Registry
 * @param incidentAddress    address of the Incident Registry
 * @param identityName       collection name reported by the Identity Registry
 * @param identitySymbol     collection symbol reported by the Identity Registry
 * @param limits             field-length ceilings
 * @param clock              source of operation timestamps
 * @see LedgerProfiles
 * @since 0.1.0
 */
public record LedgerConfig(
        long chainId,
        Address identityAddress,
        Address reputationAddress,
        Address validationAddress,
        Address incidentAddress,
        String identityName,
        String identitySymbol,
        RegistryLimits limits,
        Clock clock) {

    public static final String DEFAULT_IDENTITY_NAME = "M2M TRC-8004 Agent Registry";
    public static final String DEFAULT_IDENTITY_SYMBOL = "M2MAGENT";

    public static final Address DEFAULT_IDENTITY_ADDRESS = new Address("0x8004000000000000000000000000000000000001");
    public static final Address DEFAULT_REPUTATION_ADDRESS = new Address("0x8004000000000000000000000000000000000002");
    public static final Address DEFAULT_VALIDATION_ADDRESS = new Address("0x8004000000000000000000000000000000000003");
    public static final Address DEFAULT_INCIDENT_ADDRESS = new Address("0x8004000000000000000000000000000000000004");

    public LedgerConfig {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive, got: " + chainId);
        }
        Objects.requireNonNull(identityAddress, "identityAddress");
        Objects.requireNonNull(reputationAddress, "reputationAddress");
        Objects.requireNonNull(validationAddress, "validationAddress");
        Objects.requireNonNull(incidentAddress, "incidentAddress");
        Objects.requireNonNull(identityName, "identityName");
        Objects.requireNonNull(identitySymbol, "identitySymbol");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(clock, "clock");

        List<Address> addresses = List.of(identityAddress, reputationAddress, validationAddress, incidentAddress);
        Set<Address> distinct = new HashSet<>(addresses);
        if (distinct.size() != addresses.size()) {
            throw new IllegalArgumentException("registry addresses must be distinct: " + addresses);
        }
        if (distinct.contains(Address.ZERO)) {
            throw new IllegalArgumentException("registry addresses cannot be the zero address");
        }
        if (identityName.isBlank() || identitySymbol.isBlank()) {
            throw new IllegalArgumentException("identityName and identitySymbol cannot be blank");
        }
    }

    public RegistryId identityRegistryId() {
        return new RegistryId(chainId, identityAddress);
    }

    public RegistryId validationRegistryId() {
        return new RegistryId(chainId, validationAddress);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link LedgerConfig}. Everything except the chain id has a default;
     * the chain id defaults to the local development chain.
     */
    public static final class Builder {
        private long chainId = LedgerProfiles.LOCAL_CHAIN_ID;
        private Address identityAddress = DEFAULT_IDENTITY_ADDRESS;
        private Address reputationAddress = DEFAULT_REPUTATION_ADDRESS;
        private Address validationAddress = DEFAULT_VALIDATION_ADDRESS;
        private Address incidentAddress = DEFAULT_INCIDENT_ADDRESS;
        private String identityName = DEFAULT_IDENTITY_NAME;
        private String identitySymbol = DEFAULT_IDENTITY_SYMBOL;
        private RegistryLimits limits = RegistryLimits.defaults();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder chainId(final long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder identityAddress(final Address identityAddress) {
            this.identityAddress = identityAddress;
            return this;
        }

        public Builder reputationAddress(final Address reputationAddress) {
            this.reputationAddress = reputationAddress;
            return this;
        }

        public Builder validationAddress(final Address validationAddress) {
            this.validationAddress = validationAddress;
            return this;
        }

        public Builder incidentAddress(final Address incidentAddress) {
            this.incidentAddress = incidentAddress;
            return this;
        }

        public Builder identityName(final String identityName) {
            this.identityName = identityName;
            return this;
        }

        public Builder identitySymbol(final String identitySymbol) {
            this.identitySymbol = identitySymbol;
            return this;
        }

        public Builder limits(final RegistryLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public LedgerConfig build() {
            return new LedgerConfig(chainId, identityAddress, reputationAddress, validationAddress,
                    incidentAddress, identityName, identitySymbol, limits, clock);
        }
    }
}
