// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

/**
 * How the reporter closed an incident. {@link #NONE} marks an unresolved incident and
 * is not a valid resolution.
 */
public enum ResolutionCode {
    NONE,
    ACKNOWLEDGED,
    DISPUTED,
    FIXED,
    NOT_A_BUG,
    DUPLICATE
}
