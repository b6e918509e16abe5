// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.FeedbackValue;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * A feedback item as stored. Revocation and responses produce new copies; nothing is
 * ever removed.
 *
 * @param agentId      rated agent
 * @param index        per-agent index, starting at 0
 * @param author       submitting address
 * @param content      free text
 * @param sentiment    sentiment bucket
 * @param score        optional numeric score
 * @param tag1         primary tag, empty when absent
 * @param tag2         secondary tag, empty when absent
 * @param endpoint     rated endpoint, empty when absent
 * @param feedbackUri  off-chain details, empty when absent
 * @param feedbackHash hash of the off-chain details
 * @param createdAt    unix seconds
 * @param revoked      whether the author withdrew it
 * @param responses    response thread, oldest first
 * @since 0.1.0
 */
public record Feedback(
        AgentId agentId,
        long index,
        Address author,
        String content,
        Sentiment sentiment,
        @Nullable FeedbackValue score,
        String tag1,
        String tag2,
        String endpoint,
        String feedbackUri,
        @Nullable Hash feedbackHash,
        long createdAt,
        boolean revoked,
        List<FeedbackResponse> responses) {

    public Feedback {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(sentiment, "sentiment");
        Objects.requireNonNull(tag1, "tag1");
        Objects.requireNonNull(tag2, "tag2");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(feedbackUri, "feedbackUri");
        responses = List.copyOf(responses);
    }

    public Optional<FeedbackValue> scoreValue() {
        return Optional.ofNullable(score);
    }

    Feedback revoke() {
        return new Feedback(agentId, index, author, content, sentiment, score, tag1, tag2, endpoint,
                feedbackUri, feedbackHash, createdAt, true, responses);
    }

    Feedback withResponse(final FeedbackResponse response) {
        final List<FeedbackResponse> thread = new ArrayList<>(responses);
        thread.add(response);
        return new Feedback(agentId, index, author, content, sentiment, score, tag1, tag2, endpoint,
                feedbackUri, feedbackHash, createdAt, revoked, thread);
    }
}
