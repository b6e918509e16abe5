// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.agent.AgentId;
import sh.tessera.core.error.IntegrityViolationException;
import sh.tessera.core.error.InvalidInputException;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.NotFoundException;
import sh.tessera.core.error.UnauthorizedException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.Ledger;
import sh.tessera.registry.RegistryLimits;
import sh.tessera.registry.event.ValidationRequested;
import sh.tessera.registry.event.ValidationResolved;
import sh.tessera.registry.identity.AgentDirectory;

import static sh.tessera.registry.RegistryChecks.requireCaller;
import static sh.tessera.registry.RegistryChecks.requireMaxLength;
import static sh.tessera.registry.RegistryChecks.requireNonZero;

/**
 * Third-party capability attestations for agents.
 *
 * <p>State machine: {@code PENDING -> COMPLETED | REJECTED | CANCELLED}. The named
 * validator completes or rejects; the requester cancels. Terminal requests never change.
 * There is no expiry: a request nobody acts on stays pending.
 *
 * <p>Outcomes are integers in 0-100. The overloads without an outcome record
 * {@link #DEFAULT_COMPLETION_OUTCOME} or {@link #DEFAULT_REJECTION_OUTCOME}; a stored
 * boundary value therefore does not tell whether the validator supplied it.
 *
 * @since 0.1.0
 */
public final class ValidationRegistry {

    private static final Logger log = LoggerFactory.getLogger(ValidationRegistry.class);

    /** Outcome recorded by {@link #complete(Address, Hash, String, Hash)}. */
    public static final int DEFAULT_COMPLETION_OUTCOME = 100;

    /** Outcome recorded by {@link #reject(Address, Hash, String, Hash)}. */
    public static final int DEFAULT_REJECTION_OUTCOME = 0;

    public static final int MIN_OUTCOME = 0;
    public static final int MAX_OUTCOME = 100;

    private final Ledger ledger;
    private final AgentDirectory directory;
    private final ValidationStore store;

    public ValidationRegistry(final Ledger ledger, final AgentDirectory directory, final ValidationStore store) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.store = Objects.requireNonNull(store, "store");
    }

    public ValidationRegistry(final Ledger ledger, final AgentDirectory directory) {
        this(ledger, directory, new ValidationStore());
    }

    public Address address() {
        return ledger.config().validationAddress();
    }

    public Hash requestValidation(final Address caller, final Address validator, final AgentId agentId,
                                  final String requestUri) {
        return requestValidation(caller, validator, agentId, requestUri, null);
    }

    /**
     * Opens a validation request.
     *
     * @param caller      the requester
     * @param validator   the address allowed to rule on it
     * @param agentId     the subject agent
     * @param requestUri  request details
     * @param contentHash content hash; null or {@link Hash#ZERO} derives one from the other inputs
     * @return the derived request id
     * @throws IntegrityViolationException if the derived id already exists
     */
    public Hash requestValidation(final Address caller, final Address validator, final AgentId agentId,
                                  final String requestUri, final @Nullable Hash contentHash) {
        requireCaller(caller);
        requireNonZero(validator, "validator");
        Objects.requireNonNull(agentId, "agentId");
        final String uri = requireMaxLength(requestUri, ledger.limits().maxUriLength(), "requestUri");

        return ledger.transact("validation.request", () -> {
            requireAgent(agentId);
            final Hash content = contentHash != null && !contentHash.isZero()
                    ? contentHash
                    : RequestIds.defaultContentHash(caller, validator, agentId, uri);
            final long sequence = store.nextSequence(caller);
            final Hash requestId = RequestIds.requestId(caller, validator, agentId, content, sequence,
                    ledger.config().validationRegistryId());
            if (store.contains(requestId)) {
                log.error("Derived request id {} already exists (requester {}, sequence {})",
                        requestId, caller, sequence);
                throw IntegrityViolationException.collision(requestId);
            }
            store.insert(new ValidationRequest(requestId, caller, validator, agentId, content, uri, sequence,
                    ledger.timestamp(), ValidationStatus.PENDING, "", null, "", null, 0L));
            ledger.emit(new ValidationRequested(requestId, caller, validator, agentId, content, uri, sequence,
                    ledger.timestamp()));
            DebugLogger.logOperation("[VALIDATION] request=%s agent=%s validator=%s seq=%d",
                    requestId, agentId, validator, sequence);
            return requestId;
        });
    }

    public void complete(final Address caller, final Hash requestId, final String resultUri,
                         final @Nullable Hash resultHash) {
        complete(caller, requestId, resultUri, resultHash, DEFAULT_COMPLETION_OUTCOME, "");
    }

    public void complete(final Address caller, final Hash requestId, final String resultUri,
                         final @Nullable Hash resultHash, final int outcome, final @Nullable String tag) {
        decide("validation.complete", ValidationStatus.COMPLETED, caller, requestId, resultUri, resultHash,
                outcome, tag);
    }

    public void reject(final Address caller, final Hash requestId, final String resultUri,
                       final @Nullable Hash resultHash) {
        reject(caller, requestId, resultUri, resultHash, DEFAULT_REJECTION_OUTCOME, "");
    }

    public void reject(final Address caller, final Hash requestId, final String resultUri,
                       final @Nullable Hash resultHash, final int outcome, final @Nullable String tag) {
        decide("validation.reject", ValidationStatus.REJECTED, caller, requestId, resultUri, resultHash,
                outcome, tag);
    }

    /**
     * Withdraws a pending request. Only the requester may cancel.
     */
    public void cancel(final Address caller, final Hash requestId) {
        requireCaller(caller);
        ledger.execute("validation.cancel", () -> {
            final ValidationRequest request = requirePending(requestId);
            if (!request.requester().equals(caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the requester of " + requestId);
            }
            store.replace(request.resolve(ValidationStatus.CANCELLED, "", null, "", null, ledger.timestamp()));
            ledger.emit(new ValidationResolved(requestId, ValidationStatus.CANCELLED, caller, null, "", "", null,
                    ledger.timestamp()));
        });
    }

    private void decide(final String operation, final ValidationStatus terminal, final Address caller,
                        final Hash requestId, final String resultUri, final @Nullable Hash resultHash,
                        final int outcome, final @Nullable String tag) {
        requireCaller(caller);
        final RegistryLimits limits = ledger.limits();
        final String uri = requireMaxLength(resultUri, limits.maxUriLength(), "resultUri");
        final String category = requireMaxLength(tag, limits.maxTagLength(), "tag");
        if (outcome < MIN_OUTCOME || outcome > MAX_OUTCOME) {
            throw InvalidInputException.outOfRange("outcome", outcome, "[0, 100]");
        }

        ledger.execute(operation, () -> {
            final ValidationRequest request = requirePending(requestId);
            if (!request.validator().equals(caller)) {
                throw UnauthorizedException.notAuthorized(caller, "the validator of " + requestId);
            }
            store.replace(request.resolve(terminal, uri, resultHash, category, outcome, ledger.timestamp()));
            ledger.emit(new ValidationResolved(requestId, terminal, caller, outcome, category, uri, resultHash,
                    ledger.timestamp()));
            log.debug("Request {} {} by {} with outcome {}", requestId, terminal, caller, outcome);
        });
    }

    // ═══════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════

    public ValidationRequest request(final Hash requestId) {
        return ledger.read(() -> requireRequest(requestId));
    }

    public boolean exists(final Hash requestId) {
        Objects.requireNonNull(requestId, "requestId");
        return ledger.read(() -> store.contains(requestId));
    }

    public ValidationStatus status(final Hash requestId) {
        return ledger.read(() -> requireRequest(requestId).status());
    }

    public List<Hash> requestsByAgent(final AgentId agentId) {
        return ledger.read(() -> {
            requireAgent(agentId);
            return store.idsByAgent(agentId);
        });
    }

    public List<Hash> requestsByValidator(final Address validator) {
        Objects.requireNonNull(validator, "validator");
        return ledger.read(() -> store.idsByValidator(validator));
    }

    public List<Hash> requestsByRequester(final Address requester) {
        Objects.requireNonNull(requester, "requester");
        return ledger.read(() -> store.idsByRequester(requester));
    }

    /**
     * Sequence number the requester's next request will consume.
     */
    public long nextSequence(final Address requester) {
        Objects.requireNonNull(requester, "requester");
        return ledger.read(() -> store.nextSequence(requester));
    }

    public ValidationSummary summary(final AgentId agentId) {
        return summary(agentId, Set.of(), null);
    }

    /**
     * Summarizes an agent's requests.
     *
     * @param validators validators to include, empty for all
     * @param tag        when non-empty, only decided requests carrying this tag are counted
     */
    public ValidationSummary summary(final AgentId agentId, final Collection<Address> validators,
                                     final @Nullable String tag) {
        Objects.requireNonNull(validators, "validators");
        final Set<Address> wanted = Set.copyOf(validators);
        final boolean byTag = tag != null && !tag.isEmpty();
        return ledger.read(() -> {
            requireAgent(agentId);
            long pending = 0;
            long completed = 0;
            long rejected = 0;
            long cancelled = 0;
            long outcomeSum = 0;
            for (Hash id : store.idsByAgent(agentId)) {
                final ValidationRequest request = store.get(id).orElseThrow();
                if (!wanted.isEmpty() && !wanted.contains(request.validator())) {
                    continue;
                }
                if (byTag && !(request.status().isDecided() && tag.equals(request.tag()))) {
                    continue;
                }
                switch (request.status()) {
                    case PENDING -> pending++;
                    case COMPLETED -> completed++;
                    case REJECTED -> rejected++;
                    case CANCELLED -> cancelled++;
                }
                if (request.status().isDecided() && request.outcome() != null) {
                    outcomeSum += request.outcome();
                }
            }
            final long decided = completed + rejected;
            final int average = decided == 0 ? 0 : (int) (outcomeSum / decided);
            return new ValidationSummary(pending + completed + rejected + cancelled, pending, completed,
                    rejected, cancelled, average);
        });
    }

    private void requireAgent(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        if (!directory.exists(agentId)) {
            throw NotFoundException.agent(agentId);
        }
    }

    private ValidationRequest requireRequest(final Hash requestId) {
        Objects.requireNonNull(requestId, "requestId");
        return store.get(requestId).orElseThrow(() -> NotFoundException.request(requestId));
    }

    private ValidationRequest requirePending(final Hash requestId) {
        final ValidationRequest request = requireRequest(requestId);
        if (request.status() != ValidationStatus.PENDING) {
            throw InvalidStateException.status(requestId, request.status(), ValidationStatus.PENDING);
        }
        return request;
    }
}
