// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * The record is not in the state the requested transition needs.
 *
 * @since 0.1.0
 */
public final class InvalidStateException extends RegistryException {

    public InvalidStateException(final RegistryError error, final String message) {
        super(requireCategory(error, RegistryError.Category.STATE), message);
    }

    public static InvalidStateException status(final Object id, final Object actual, final Object required) {
        return new InvalidStateException(RegistryError.INVALID_STATUS,
                "%s is %s, expected %s".formatted(id, actual, required));
    }

    public static InvalidStateException threadFull(final long index, final int max) {
        return new InvalidStateException(RegistryError.THREAD_FULL,
                "feedback #" + index + " already has " + max + " responses");
    }
}
