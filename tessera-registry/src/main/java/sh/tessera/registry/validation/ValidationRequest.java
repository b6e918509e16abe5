// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * A validation request and, once terminal, its result.
 *
 * @param requestId   derived identifier
 * @param requester   creating address; the only one that may cancel
 * @param validator   the only address that may complete or reject
 * @param agentId     subject agent
 * @param contentHash supplied or derived content hash
 * @param requestUri  request details, empty when absent
 * @param sequence    requester sequence number folded into the id
 * @param createdAt   unix seconds
 * @param status      current state
 * @param resultUri   validator's result reference, empty until decided
 * @param resultHash  validator's result hash
 * @param tag         category tag, empty when absent
 * @param outcome     0-100 once decided, null while pending or when cancelled
 * @param resolvedAt  unix seconds of the terminal transition, 0 while pending
 * @since 0.1.0
 */
public record ValidationRequest(
        Hash requestId,
        Address requester,
        Address validator,
        AgentId agentId,
        Hash contentHash,
        String requestUri,
        long sequence,
        long createdAt,
        ValidationStatus status,
        String resultUri,
        @Nullable Hash resultHash,
        String tag,
        @Nullable Integer outcome,
        long resolvedAt) {

    public ValidationRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(validator, "validator");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(requestUri, "requestUri");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(resultUri, "resultUri");
        Objects.requireNonNull(tag, "tag");
    }

    public Optional<Integer> outcomeValue() {
        return Optional.ofNullable(outcome);
    }

    ValidationRequest resolve(final ValidationStatus terminal, final String uri, final @Nullable Hash hash,
                              final String newTag, final @Nullable Integer newOutcome, final long timestamp) {
        return new ValidationRequest(requestId, requester, validator, agentId, contentHash, requestUri, sequence,
                createdAt, terminal, uri, hash, newTag, newOutcome, timestamp);
    }
}
