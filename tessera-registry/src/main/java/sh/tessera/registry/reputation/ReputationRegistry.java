// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.agent.AgentId;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.NotFoundException;
import sh.tessera.core.error.RegistryError;
import sh.tessera.core.error.UnauthorizedException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.Ledger;
import sh.tessera.registry.RegistryLimits;
import sh.tessera.registry.event.FeedbackRevoked;
import sh.tessera.registry.event.FeedbackSubmitted;
import sh.tessera.registry.event.ResponseAppended;
import sh.tessera.registry.identity.AgentDirectory;

import static sh.tessera.registry.RegistryChecks.requireCaller;
import static sh.tessera.registry.RegistryChecks.requireMaxLength;
import static sh.tessera.registry.RegistryChecks.requireText;

/**
 * Append-only feedback ledger per agent.
 *
 * <p>Anyone except the agent's owner and delegated wallet may submit feedback. Authors
 * may revoke their own items once; the agent's owner or delegate may answer an item
 * with a bounded response thread. Nothing is deleted.
 *
 * <p>Summaries report sentiment tallies and an exact numeric-score sum side by side,
 * so consumers are never limited to a score average.
 *
 * @since 0.1.0
 */
public final class ReputationRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReputationRegistry.class);

    private final Ledger ledger;
    private final AgentDirectory directory;
    private final FeedbackStore store;

    public ReputationRegistry(final Ledger ledger, final AgentDirectory directory, final FeedbackStore store) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.store = Objects.requireNonNull(store, "store");
    }

    public ReputationRegistry(final Ledger ledger, final AgentDirectory directory) {
        this(ledger, directory, new FeedbackStore());
    }

    public Address address() {
        return ledger.config().reputationAddress();
    }

    /**
     * Submits feedback with only content and sentiment.
     *
     * @return the new feedback index
     */
    public long submitFeedback(final Address caller, final AgentId agentId, final String content,
                               final Sentiment sentiment) {
        return submitFeedback(caller, agentId, FeedbackInput.of(content, sentiment));
    }

    /**
     * Appends a feedback item to an agent's ledger.
     *
     * @param caller  the author
     * @param agentId the rated agent
     * @param input   content, sentiment and optional score, tags and references
     * @return the new feedback index, starting at 0 for each agent
     * @throws NotFoundException     if the agent does not exist
     * @throws UnauthorizedException with {@link RegistryError#SELF_FEEDBACK} if the caller
     *                               is the agent's owner or delegated wallet
     */
    public long submitFeedback(final Address caller, final AgentId agentId, final FeedbackInput input) {
        requireCaller(caller);
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(input, "input");
        final RegistryLimits limits = ledger.limits();
        requireMaxLength(input.content(), limits.maxTextLength(), "content");
        requireMaxLength(input.tag1(), limits.maxTagLength(), "tag1");
        requireMaxLength(input.tag2(), limits.maxTagLength(), "tag2");
        requireMaxLength(input.endpoint(), limits.maxEndpointLength(), "endpoint");
        requireMaxLength(input.feedbackUri(), limits.maxUriLength(), "feedbackUri");

        return ledger.transact("reputation.submitFeedback", () -> {
            requireAgent(agentId);
            if (directory.isAuthority(agentId, caller)) {
                throw UnauthorizedException.selfFeedback(caller, agentId);
            }
            final long index = store.count(agentId);
            final Feedback feedback = new Feedback(agentId, index, caller, input.content(), input.sentiment(),
                    input.score(), input.tag1(), input.tag2(), input.endpoint(), input.feedbackUri(),
                    input.feedbackHash(), ledger.timestamp(), false, List.of());
            store.append(feedback);
            ledger.emit(new FeedbackSubmitted(agentId, caller, index, feedback.content(), feedback.sentiment(),
                    feedback.score(), feedback.tag1(), feedback.tag2(), feedback.endpoint(),
                    feedback.feedbackUri(), feedback.feedbackHash(), feedback.createdAt()));
            log.debug("Feedback #{} for {} from {}", index, agentId, caller);
            DebugLogger.logOperation("[FEEDBACK] agent=%s index=%d author=%s sentiment=%s",
                    agentId, index, caller, input.sentiment());
            return index;
        });
    }

    /**
     * Marks the caller's own feedback as revoked. Revocation cannot be undone.
     */
    public void revokeFeedback(final Address caller, final AgentId agentId, final long index) {
        requireCaller(caller);
        ledger.execute("reputation.revokeFeedback", () -> {
            final Feedback feedback = requireFeedback(agentId, index);
            if (!feedback.author().equals(caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the author of feedback #" + index);
            }
            if (feedback.revoked()) {
                throw new InvalidStateException(RegistryError.ALREADY_REVOKED,
                        "feedback #" + index + " for " + agentId + " is already revoked");
            }
            store.replace(feedback.revoke());
            ledger.emit(new FeedbackRevoked(agentId, caller, index));
        });
    }

    /**
     * Appends a response from the agent's owner or delegated wallet.
     *
     * @return the response's position in the thread
     * @throws InvalidStateException with {@link RegistryError#FEEDBACK_REVOKED} or
     *                               {@link RegistryError#THREAD_FULL}
     */
    public int appendResponse(final Address caller, final AgentId agentId, final long index,
                              final String text, final @Nullable String uri, final @Nullable Hash hash) {
        requireCaller(caller);
        final RegistryLimits limits = ledger.limits();
        final String body = requireText(text, limits.maxTextLength(), "response text");
        final String ref = requireMaxLength(uri, limits.maxUriLength(), "response uri");

        return ledger.transact("reputation.appendResponse", () -> {
            final Feedback feedback = requireFeedback(agentId, index);
            if (!directory.isAuthority(agentId, caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the owner or delegate of " + agentId);
            }
            if (feedback.revoked()) {
                throw new InvalidStateException(RegistryError.FEEDBACK_REVOKED,
                        "feedback #" + index + " for " + agentId + " was revoked");
            }
            if (feedback.responses().size() >= limits.maxResponses()) {
                throw InvalidStateException.threadFull(index, limits.maxResponses());
            }
            final int responseIndex = feedback.responses().size();
            store.replace(feedback.withResponse(new FeedbackResponse(caller, body, ref, hash, ledger.timestamp())));
            ledger.emit(new ResponseAppended(agentId, index, responseIndex, caller, body, ref, hash,
                    ledger.timestamp()));
            return responseIndex;
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════

    public Feedback feedback(final AgentId agentId, final long index) {
        return ledger.read(() -> requireFeedback(agentId, index));
    }

    public long feedbackCount(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            return store.count(agentId);
        });
    }

    public int responseCount(final AgentId agentId, final long index) {
        return ledger.read(() -> requireFeedback(agentId, index).responses().size());
    }

    /**
     * Returns every address that ever submitted feedback for an agent, in order of
     * first submission. Authors of revoked items are included.
     */
    public List<Address> authors(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            return store.authors(agentId);
        });
    }

    public FeedbackSummary summary(final AgentId agentId) {
        return summary(agentId, FeedbackFilter.any());
    }

    public FeedbackSummary summary(final AgentId agentId, final FeedbackFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return ledger.read(() -> {
            requireAgent(agentId);
            long total = 0;
            long revoked = 0;
            long positive = 0;
            long neutral = 0;
            long negative = 0;
            long scoreCount = 0;
            BigDecimal scoreSum = BigDecimal.ZERO;
            for (Feedback feedback : store.all(agentId)) {
                if (!filter.matches(feedback)) {
                    continue;
                }
                total++;
                if (feedback.revoked()) {
                    revoked++;
                    continue;
                }
                switch (feedback.sentiment()) {
                    case POSITIVE -> positive++;
                    case NEUTRAL -> neutral++;
                    case NEGATIVE -> negative++;
                }
                if (feedback.score() != null) {
                    scoreCount++;
                    scoreSum = scoreSum.add(feedback.score().toBigDecimal());
                }
            }
            return new FeedbackSummary(total, total - revoked, revoked, positive, neutral, negative,
                    scoreCount, scoreSum);
        });
    }

    /**
     * Lists indices of feedback matching a filter, in index order.
     *
     * @param includeRevoked whether revoked items are listed
     */
    public List<Long> matchingIndices(final AgentId agentId, final FeedbackFilter filter,
                                      final boolean includeRevoked) {
        Objects.requireNonNull(filter, "filter");
        return ledger.read(() -> {
            requireAgent(agentId);
            final List<Long> indices = new ArrayList<>();
            for (Feedback feedback : store.all(agentId)) {
                if (filter.matches(feedback) && (includeRevoked || !feedback.revoked())) {
                    indices.add(feedback.index());
                }
            }
            return List.copyOf(indices);
        });
    }

    private void requireAgent(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        if (!directory.exists(agentId)) {
            throw NotFoundException.agent(agentId);
        }
    }

    private Feedback requireFeedback(final AgentId agentId, final long index) {
        requireAgent(agentId);
        return store.get(agentId, index).orElseThrow(() -> NotFoundException.feedback(agentId, index));
    }
}
