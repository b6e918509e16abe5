// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import sh.tessera.core.types.Address;

/**
 * Ledgers on a fixed clock for registry tests.
 */
public final class TestLedgers {

    /** Unix time every test transaction runs at. */
    public static final long NOW = 1_700_000_000L;

    public static final Address OWNER = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    public static final Address CLIENT = new Address("0x" + "c".repeat(40));
    public static final Address STRANGER = new Address("0x" + "5".repeat(40));
    public static final Address BUYER = new Address("0x" + "b".repeat(40));

    /** Matches {@link #OWNER}. */
    public static final String OWNER_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    /** Address 0x70997970c51812dc3a010c7d01b50e0d17dc79c8. */
    public static final String WALLET_KEY = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";
    /** Address 0x3c44cdddb6a900fa2b585dd299e03d12fa4293bc. */
    public static final String OTHER_KEY = "0x5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a";

    private TestLedgers() {
    }

    public static LedgerConfig config() {
        return LedgerConfig.builder()
                .chainId(LedgerProfiles.LOCAL_CHAIN_ID)
                .clock(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC))
                .build();
    }

    public static Ledger ledger() {
        return new Ledger(config());
    }

    public static Ledger ledger(final RegistryLimits limits) {
        return new Ledger(LedgerConfig.builder()
                .clock(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC))
                .limits(limits)
                .build());
    }
}
