// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import sh.tessera.core.abi.Words;
import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.RegistryId;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Deterministic identifiers for validation requests.
 *
 * <p>The request id is {@code keccak256} over seven 32-byte words:
 * <pre>
 * requester | validator | agentId | contentHash | sequence | chainId | registry
 * </pre>
 * Sequence numbers are per requester and only increase, so no two requests from one
 * requester share an id. The {@link RegistryId} of the Validation Registry separates
 * deployments.
 */
public final class RequestIds {

    private RequestIds() {
    }

    public static Hash requestId(final Address requester, final Address validator, final AgentId agentId,
                                 final Hash contentHash, final long sequence, final RegistryId registry) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(registry, "registry");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative: " + sequence);
        }
        final byte[] preimage = Words.builder()
                .address(requester)
                .address(validator)
                .uint(agentId.value())
                .bytes32(contentHash)
                .uint(sequence)
                .uint(registry.chainId())
                .address(registry.address())
                .toByteArray();
        return Hash.fromBytes(Keccak256.hash(preimage));
    }

    /**
     * Content hash used when the requester supplies none:
     * {@code keccak256(requester | validator | agentId | keccak256(requestUri))}.
     */
    public static Hash defaultContentHash(final Address requester, final Address validator,
                                          final AgentId agentId, final String requestUri) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(requestUri, "requestUri");
        final byte[] uriHash = Keccak256.hash(requestUri.getBytes(StandardCharsets.UTF_8));
        final byte[] preimage = Words.builder()
                .address(requester)
                .address(validator)
                .uint(agentId.value())
                .word(uriHash)
                .toByteArray();
        return Hash.fromBytes(Keccak256.hash(preimage));
    }
}
