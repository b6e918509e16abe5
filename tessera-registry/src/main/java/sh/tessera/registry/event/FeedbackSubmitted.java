// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.FeedbackValue;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.reputation.Sentiment;

/**
 * Feedback was appended to an agent's ledger.
 *
 * @param agentId       the rated agent
 * @param author        the submitting address
 * @param feedbackIndex the per-agent index, starting at 0
 * @param content       free text
 * @param sentiment     discrete sentiment bucket
 * @param score         optional numeric score
 * @param tag1          primary tag, possibly empty
 * @param tag2          secondary tag, possibly empty
 * @param endpoint      the rated endpoint, possibly empty
 * @param feedbackUri   off-chain details, possibly empty
 * @param feedbackHash  hash of the off-chain details, or null
 * @param timestamp     submission time in unix seconds
 */
public record FeedbackSubmitted(
        AgentId agentId,
        Address author,
        long feedbackIndex,
        String content,
        Sentiment sentiment,
        @Nullable FeedbackValue score,
        String tag1,
        String tag2,
        String endpoint,
        String feedbackUri,
        @Nullable Hash feedbackHash,
        long timestamp) implements LedgerEvent {
}
