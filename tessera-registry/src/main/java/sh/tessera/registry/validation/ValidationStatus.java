// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

/**
 * Validation request states. {@code PENDING} moves to exactly one terminal state.
 */
public enum ValidationStatus {
    PENDING,
    COMPLETED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Whether the validator ruled on the request (completed or rejected).
     */
    public boolean isDecided() {
        return this == COMPLETED || this == REJECTED;
    }
}
