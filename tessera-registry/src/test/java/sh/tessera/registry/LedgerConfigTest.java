// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.tessera.core.types.Address;

class LedgerConfigTest {

    @Test
    void defaults() {
        LedgerConfig config = LedgerConfig.builder().build();

        assertEquals(LedgerProfiles.LOCAL_CHAIN_ID, config.chainId());
        assertEquals("M2M TRC-8004 Agent Registry", config.identityName());
        assertEquals("M2MAGENT", config.identitySymbol());
        assertEquals(RegistryLimits.defaults(), config.limits());
        assertEquals("eip155:31337:" + LedgerConfig.DEFAULT_IDENTITY_ADDRESS.value(),
                config.identityRegistryId().toString());
    }

    @Test
    void rejectsNonPositiveChainId() {
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.builder().chainId(0).build());
    }

    @Test
    void rejectsDuplicateRegistryAddresses() {
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.builder()
                .incidentAddress(LedgerConfig.DEFAULT_IDENTITY_ADDRESS)
                .build());
    }

    @Test
    void rejectsZeroRegistryAddress() {
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.builder()
                .validationAddress(Address.ZERO)
                .build());
    }

    @Test
    void rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.builder().identityName(" ").build());
    }

    @Test
    void profilesCarryTheirChainIds() {
        assertEquals(31337L, LedgerProfiles.local().chainId());
        assertEquals(LedgerProfiles.TRON_MAINNET_CHAIN_ID, LedgerProfiles.tronMainnet().chainId());
        assertEquals(LedgerProfiles.TRON_SHASTA_CHAIN_ID, LedgerProfiles.tronShasta().chainId());
    }

    @Test
    void limitsDefaultsAndOverrides() {
        RegistryLimits limits = RegistryLimits.builder().maxResponses(5).build();

        assertEquals(5, limits.maxResponses());
        assertEquals(2048, limits.maxUriLength());
        assertEquals(2048, limits.maxTextLength());
        assertEquals(128, limits.maxTagLength());
        assertEquals(512, limits.maxEndpointLength());
        assertEquals(128, limits.maxMetadataKeyLength());
        assertEquals(30, RegistryLimits.defaults().maxResponses());
    }

    @Test
    void limitsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> RegistryLimits.builder().maxTagLength(0).build());
    }
}
