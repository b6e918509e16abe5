// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

/**
 * Incident states, advanced strictly in declaration order.
 */
public enum IncidentStatus {
    OPEN,
    RESPONDED,
    RESOLVED
}
