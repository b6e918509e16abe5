// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Typed-data encoding failure: unknown type, missing field, or a value that
 * does not fit its declared type.
 *
 * @since 0.1.0
 */
public final class Eip712Exception extends TesseraException {

    public Eip712Exception(final String message) {
        super(message);
    }

    public Eip712Exception(final String message, final Throwable cause) {
        super(message, cause);
    }

    public static Eip712Exception unknownType(final String type) {
        return new Eip712Exception("Unknown EIP-712 type: " + type);
    }

    public static Eip712Exception missingField(final String typeName, final String fieldName) {
        return new Eip712Exception("Missing field '%s' in type '%s'".formatted(fieldName, typeName));
    }

    public static Eip712Exception invalidValue(final String type, final Object value) {
        return new Eip712Exception("Invalid value for type '%s': %s".formatted(type, value));
    }

    public static Eip712Exception cyclicDependency(final String typeName) {
        return new Eip712Exception("Cyclic type dependency at: " + typeName);
    }
}
