// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

/**
 * Discrete feedback classification, stored independently of any numeric score.
 */
public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE
}
