// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;

/**
 * An author withdrew its feedback. The record stays, marked revoked.
 *
 * @param agentId       the rated agent
 * @param author        the author
 * @param feedbackIndex the revoked index
 */
public record FeedbackRevoked(AgentId agentId, Address author, long feedbackIndex) implements LedgerEvent {
}
