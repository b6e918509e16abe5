// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.agent;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed fixed-point feedback score with an explicit decimal scale.
 *
 * <ul>
 *   <li>{@code value=9977, decimals=2} is 99.77</li>
 *   <li>{@code value=-32, decimals=1} is -3.2</li>
 * </ul>
 *
 * <p>The raw value must fit a signed 128-bit integer.
 *
 * @param value    the raw score value
 * @param decimals the number of decimal places (0-18)
 */
public record FeedbackValue(BigInteger value, int decimals) {

    /** Largest supported decimal scale. */
    public static final int MAX_DECIMALS = 18;

    private static final int VALUE_BITS = 128;

    public FeedbackValue {
        Objects.requireNonNull(value, "value");
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals must be 0-18, got " + decimals);
        }
        if (value.bitLength() > VALUE_BITS - 1) {
            throw new IllegalArgumentException("value does not fit int128: " + value);
        }
    }

    public static FeedbackValue of(long value, int decimals) {
        return new FeedbackValue(BigInteger.valueOf(value), decimals);
    }

    /**
     * Converts a decimal to a feedback value at the decimal's own scale.
     *
     * @param decimal the decimal
     * @return the feedback value
     * @throws IllegalArgumentException if the scale is outside 0-18 or the value is too large
     */
    public static FeedbackValue fromBigDecimal(BigDecimal decimal) {
        Objects.requireNonNull(decimal, "decimal");
        BigDecimal normalized = decimal.scale() < 0 ? decimal.setScale(0) : decimal;
        return new FeedbackValue(normalized.unscaledValue(), normalized.scale());
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(value, decimals);
    }
}
