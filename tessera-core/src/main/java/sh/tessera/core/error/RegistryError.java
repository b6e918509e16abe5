// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Reason codes carried by every registry failure.
 *
 * <p>Each code belongs to exactly one {@link Category}, and each category maps to
 * one exception type, so callers can branch either on the exception class or on
 * the code.
 *
 * @since 0.1.0
 */
public enum RegistryError {

    ZERO_ADDRESS(Category.INPUT),
    FIELD_TOO_LONG(Category.INPUT),
    EMPTY_FIELD(Category.INPUT),
    LENGTH_MISMATCH(Category.INPUT),
    RESERVED_KEY(Category.INPUT),
    VALUE_OUT_OF_RANGE(Category.INPUT),

    AGENT_NOT_FOUND(Category.REFERENCE),
    FEEDBACK_NOT_FOUND(Category.REFERENCE),
    REQUEST_NOT_FOUND(Category.REFERENCE),
    INCIDENT_NOT_FOUND(Category.REFERENCE),

    NOT_AUTHORIZED(Category.AUTHORIZATION),
    SELF_FEEDBACK(Category.AUTHORIZATION),

    ALREADY_REVOKED(Category.STATE),
    FEEDBACK_REVOKED(Category.STATE),
    THREAD_FULL(Category.STATE),
    ALREADY_ACTIVE(Category.STATE),
    ALREADY_INACTIVE(Category.STATE),
    WALLET_NOT_SET(Category.STATE),
    PROOF_EXPIRED(Category.STATE),
    INVALID_PROOF(Category.STATE),
    INVALID_STATUS(Category.STATE),
    UNSAFE_RECIPIENT(Category.STATE),
    REENTRANT_CALL(Category.STATE),

    IDENTIFIER_COLLISION(Category.INTEGRITY);

    /**
     * Error taxonomy.
     */
    public enum Category {
        /** Malformed or oversized input. */
        INPUT,
        /** Reference to a record that does not exist. */
        REFERENCE,
        /** Caller lacks the relation the operation requires. */
        AUTHORIZATION,
        /** Record is not in the state the transition requires. */
        STATE,
        /** An invariant that the design makes unreachable was violated. */
        INTEGRITY
    }

    private final Category category;

    RegistryError(final Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
