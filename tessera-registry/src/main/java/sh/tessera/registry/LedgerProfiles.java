// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

/**
 * Ready-made {@link LedgerConfig}s for well-known execution environments.
 */
public final class LedgerProfiles {

    public static final long LOCAL_CHAIN_ID = 31337L;
    public static final long TRON_MAINNET_CHAIN_ID = 728126428L;
    public static final long TRON_SHASTA_CHAIN_ID = 2494104990L;

    private LedgerProfiles() {}

    public static LedgerConfig local() {
        return LedgerConfig.builder().chainId(LOCAL_CHAIN_ID).build();
    }

    public static LedgerConfig tronMainnet() {
        return LedgerConfig.builder().chainId(TRON_MAINNET_CHAIN_ID).build();
    }

    public static LedgerConfig tronShasta() {
        return LedgerConfig.builder().chainId(TRON_SHASTA_CHAIN_ID).build();
    }
}
