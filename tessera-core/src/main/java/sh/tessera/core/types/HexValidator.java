// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length, {@code 0x}-prefixed hex strings.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a pattern matching {@code 0x} followed by exactly {@code byteLength * 2}
     * hex characters of either case.
     *
     * @param byteLength the number of bytes the string must encode
     * @return the compiled pattern
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
