// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.error.InvalidInputException;
import sh.tessera.core.types.Address;

/**
 * Input checks shared by the registries. Each throws {@link InvalidInputException}
 * so callers can run every check before their first write.
 */
public final class RegistryChecks {

    private RegistryChecks() {
    }

    public static Address requireCaller(final Address caller) {
        return requireNonZero(caller, "caller");
    }

    public static Address requireNonZero(final Address address, final String field) {
        Objects.requireNonNull(address, field);
        if (address.isZero()) {
            throw InvalidInputException.zeroAddress(field);
        }
        return address;
    }

    /**
     * Normalizes an optional string to empty and enforces a length ceiling.
     *
     * @param value the value, or null
     * @param max   maximum length in chars
     * @param field name used in the error
     * @return the value, or {@code ""} for null
     */
    public static String requireMaxLength(final @Nullable String value, final int max, final String field) {
        final String text = value == null ? "" : value;
        if (text.length() > max) {
            throw InvalidInputException.tooLong(field, text.length(), max);
        }
        return text;
    }

    public static String requireText(final @Nullable String value, final int max, final String field) {
        final String text = requireMaxLength(value, max, field);
        if (text.isEmpty()) {
            throw InvalidInputException.empty(field);
        }
        return text;
    }
}
