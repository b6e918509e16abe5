// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import java.util.Objects;

/**
 * A registry operation was rejected. No state changed and no event was emitted.
 *
 * <p>The subclass names the error category; {@link #error()} names the exact reason.
 *
 * @since 0.1.0
 */
public abstract sealed class RegistryException extends TesseraException
        permits InvalidInputException,
        NotFoundException,
        UnauthorizedException,
        InvalidStateException,
        IntegrityViolationException {

    private final RegistryError error;

    protected RegistryException(final RegistryError error, final String message) {
        super(error + ": " + message);
        this.error = Objects.requireNonNull(error, "error");
    }

    protected RegistryException(final RegistryError error, final String message, final Throwable cause) {
        super(error + ": " + message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * Returns the reason code.
     *
     * @return the reason
     */
    public RegistryError error() {
        return error;
    }

    static RegistryError requireCategory(final RegistryError error, final RegistryError.Category category) {
        Objects.requireNonNull(error, "error");
        if (error.category() != category) {
            throw new IllegalArgumentException(error + " is not a " + category + " error");
        }
        return error;
    }
}
