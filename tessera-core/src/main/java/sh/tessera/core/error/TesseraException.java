// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Base runtime exception for all tessera failures.
 *
 * <p>
 * The hierarchy is sealed so every failure a registry can raise is one of a
 * known set of types:
 * <pre>
 * TesseraException
 * ├── {@link Eip712Exception} - typed-data encoding failures
 * └── {@link RegistryException} - a registry operation was rejected
 *     ├── {@link InvalidInputException}
 *     ├── {@link NotFoundException}
 *     ├── {@link UnauthorizedException}
 *     ├── {@link InvalidStateException}
 *     └── {@link IntegrityViolationException}
 * </pre>
 *
 * <pre>{@code
 * try {
 *     reputation.revokeFeedback(author, agentId, 0);
 * } catch (InvalidStateException e) {
 *     // already revoked
 * } catch (TesseraException e) {
 *     // anything else
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public abstract sealed class TesseraException extends RuntimeException
        permits Eip712Exception, RegistryException {

    protected TesseraException(final String message) {
        super(message);
    }

    protected TesseraException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
