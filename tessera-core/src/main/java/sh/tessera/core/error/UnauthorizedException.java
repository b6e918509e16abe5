// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * The caller is not the owner, delegate, author or designated counterparty the
 * operation requires, or is trying to rate an agent it controls.
 *
 * @since 0.1.0
 */
public final class UnauthorizedException extends RegistryException {

    public UnauthorizedException(final RegistryError error, final String message) {
        super(requireCategory(error, RegistryError.Category.AUTHORIZATION), message);
    }

    public static UnauthorizedException notAuthorized(final Object caller, final String required) {
        return new UnauthorizedException(RegistryError.NOT_AUTHORIZED,
                "caller " + caller + " is not " + required);
    }

    public static UnauthorizedException selfFeedback(final Object caller, final Object agentId) {
        return new UnauthorizedException(RegistryError.SELF_FEEDBACK,
                "caller " + caller + " controls " + agentId + " and cannot rate it");
    }
}
