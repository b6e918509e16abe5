// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.validation;

/**
 * Request counts for an agent and the mean outcome of decided requests.
 *
 * @param total          matching requests
 * @param pending        still pending
 * @param completed      completed
 * @param rejected       rejected
 * @param cancelled      cancelled by the requester
 * @param averageOutcome floor of the mean outcome over completed and rejected requests, 0 when none
 */
public record ValidationSummary(
        long total,
        long pending,
        long completed,
        long rejected,
        long cancelled,
        int averageOutcome) {
}
