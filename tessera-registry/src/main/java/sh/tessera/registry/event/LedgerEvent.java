// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Structured notification emitted by a committed registry operation.
 *
 * <p>Each event carries the identifiers and post-state fields an observer needs to
 * rebuild registry state without reading storage.
 *
 * @since 0.1.0
 */
public sealed interface LedgerEvent
        permits AgentRegistered,
        AgentUriUpdated,
        MetadataSet,
        AgentWalletSet,
        AgentWalletCleared,
        AgentDeactivated,
        AgentReactivated,
        AgentTransferred,
        AgentApproval,
        OperatorApproval,
        FeedbackSubmitted,
        FeedbackRevoked,
        ResponseAppended,
        ValidationRequested,
        ValidationResolved,
        IncidentReported,
        IncidentResponded,
        IncidentResolved {

    /**
     * Returns the event name used in logs and JSON envelopes.
     *
     * @return the simple type name
     */
    @JsonIgnore
    default String name() {
        return getClass().getSimpleName();
    }
}
