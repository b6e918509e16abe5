// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.agent.AgentId;

public record AgentDeactivated(AgentId agentId, long timestamp) implements LedgerEvent {
}
