// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.math.BigDecimal;

/**
 * Aggregate view of an agent's feedback under a filter.
 *
 * <p>{@code total} includes revoked items. Sentiment buckets and the score figures
 * count active items only. {@code scoreSum} is exact, at the largest decimal scale
 * among the summed scores.
 *
 * @param total      matching items, revoked included
 * @param active     {@code total - revoked}
 * @param revoked    matching revoked items
 * @param positive   active positive items
 * @param neutral    active neutral items
 * @param negative   active negative items
 * @param scoreCount active items carrying a score
 * @param scoreSum   sum of those scores
 */
public record FeedbackSummary(
        long total,
        long active,
        long revoked,
        long positive,
        long neutral,
        long negative,
        long scoreCount,
        BigDecimal scoreSum) {

    public static final FeedbackSummary EMPTY = new FeedbackSummary(0, 0, 0, 0, 0, 0, 0, BigDecimal.ZERO);
}
