// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * The agent's owner or delegate answered a feedback item.
 *
 * @param agentId       the agent
 * @param feedbackIndex the feedback answered
 * @param responseIndex position in the thread, starting at 0
 * @param responder     the caller
 * @param text          response text
 * @param uri           optional reference, possibly empty
 * @param hash          optional reference hash, or null
 * @param timestamp     time in unix seconds
 */
public record ResponseAppended(
        AgentId agentId,
        long feedbackIndex,
        int responseIndex,
        Address responder,
        String text,
        String uri,
        @Nullable Hash hash,
        long timestamp) implements LedgerEvent {
}
