// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.agent;

import java.util.Objects;

import sh.tessera.core.types.Address;

/**
 * Identifies one registry deployment: a chain id plus the registry's address.
 *
 * <p>Format: {@code eip155:{chainId}:{address}}, structurally a
 * <a href="https://chainagnostic.org/CAIPs/caip-10">CAIP-10</a> account id.
 * The pair is the execution environment identifier folded into derived request
 * ids and signing domains.
 *
 * @param chainId the chain id (positive)
 * @param address the registry address
 */
public record RegistryId(long chainId, Address address) {

    private static final String NAMESPACE = "eip155";

    public RegistryId {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive, got " + chainId);
        }
        Objects.requireNonNull(address, "address");
    }

    /**
     * Parses {@code eip155:{chainId}:{address}}.
     *
     * @param id the identifier
     * @return the parsed RegistryId
     * @throws IllegalArgumentException if the format or namespace is wrong
     */
    public static RegistryId parse(String id) {
        Objects.requireNonNull(id, "id");
        String[] parts = id.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected format eip155:{chainId}:{address}, got: " + id);
        }
        if (!NAMESPACE.equals(parts[0])) {
            throw new IllegalArgumentException("Unsupported namespace: " + parts[0]);
        }
        return new RegistryId(Long.parseLong(parts[1]), new Address(parts[2]));
    }

    @Override
    public String toString() {
        return NAMESPACE + ":" + chainId + ":" + address.value();
    }
}
