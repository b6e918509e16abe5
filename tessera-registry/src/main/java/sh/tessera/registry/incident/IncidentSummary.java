// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

public record IncidentSummary(long total, long open, long responded, long resolved) {
}
