// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * The operation referenced an agent, feedback index, validation request or
 * incident that does not exist.
 *
 * @since 0.1.0
 */
public final class NotFoundException extends RegistryException {

    public NotFoundException(final RegistryError error, final String message) {
        super(requireCategory(error, RegistryError.Category.REFERENCE), message);
    }

    public static NotFoundException agent(final Object agentId) {
        return new NotFoundException(RegistryError.AGENT_NOT_FOUND, "no agent " + agentId);
    }

    public static NotFoundException feedback(final Object agentId, final long index) {
        return new NotFoundException(RegistryError.FEEDBACK_NOT_FOUND,
                "no feedback #" + index + " for " + agentId);
    }

    public static NotFoundException request(final Object requestId) {
        return new NotFoundException(RegistryError.REQUEST_NOT_FOUND, "no validation request " + requestId);
    }

    public static NotFoundException incident(final Object incidentId) {
        return new NotFoundException(RegistryError.INCIDENT_NOT_FOUND, "no incident " + incidentId);
    }
}
