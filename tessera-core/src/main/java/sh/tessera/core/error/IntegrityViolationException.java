// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * An invariant that identifier derivation makes unreachable was observed broken.
 * Treat as fatal: the operation is aborted and nothing is overwritten.
 *
 * @since 0.1.0
 */
public final class IntegrityViolationException extends RegistryException {

    public IntegrityViolationException(final RegistryError error, final String message) {
        super(requireCategory(error, RegistryError.Category.INTEGRITY), message);
    }

    public static IntegrityViolationException collision(final Object id) {
        return new IntegrityViolationException(RegistryError.IDENTIFIER_COLLISION,
                "derived identifier " + id + " already exists");
    }
}
