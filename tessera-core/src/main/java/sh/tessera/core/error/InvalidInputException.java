// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Input failed validation: zero address, oversized or empty field, mismatched
 * parallel arrays, reserved key, or a numeric value out of range.
 *
 * @since 0.1.0
 */
public final class InvalidInputException extends RegistryException {

    public InvalidInputException(final RegistryError error, final String message) {
        super(requireCategory(error, RegistryError.Category.INPUT), message);
    }

    public static InvalidInputException zeroAddress(final String field) {
        return new InvalidInputException(RegistryError.ZERO_ADDRESS, field + " cannot be the zero address");
    }

    public static InvalidInputException tooLong(final String field, final int length, final int max) {
        return new InvalidInputException(RegistryError.FIELD_TOO_LONG,
                "%s is %d chars, limit is %d".formatted(field, length, max));
    }

    public static InvalidInputException empty(final String field) {
        return new InvalidInputException(RegistryError.EMPTY_FIELD, field + " cannot be empty");
    }

    public static InvalidInputException lengthMismatch(final String left, final int leftSize,
                                                       final String right, final int rightSize) {
        return new InvalidInputException(RegistryError.LENGTH_MISMATCH,
                "%s has %d entries but %s has %d".formatted(left, leftSize, right, rightSize));
    }

    public static InvalidInputException reservedKey(final String key) {
        return new InvalidInputException(RegistryError.RESERVED_KEY, "metadata key '" + key + "' is reserved");
    }

    public static InvalidInputException outOfRange(final String field, final Object value, final String range) {
        return new InvalidInputException(RegistryError.VALUE_OUT_OF_RANGE,
                "%s=%s outside %s".formatted(field, value, range));
    }
}
