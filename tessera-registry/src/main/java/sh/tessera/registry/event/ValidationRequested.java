// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * A validation request was created in the Pending state.
 *
 * @param requestId   the derived identifier
 * @param requester   the caller
 * @param validator   the designated validator
 * @param agentId     the subject agent
 * @param contentHash supplied or derived content hash
 * @param requestUri  request details, possibly empty
 * @param sequence    the requester's sequence number consumed by this request
 * @param timestamp   creation time in unix seconds
 */
public record ValidationRequested(
        Hash requestId,
        Address requester,
        Address validator,
        AgentId agentId,
        Hash contentHash,
        String requestUri,
        long sequence,
        long timestamp) implements LedgerEvent {
}
