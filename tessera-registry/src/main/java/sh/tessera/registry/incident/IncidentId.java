// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.incident;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sequential incident identifier. Ids start at 1.
 *
 * @param value the numeric id
 */
public record IncidentId(@JsonValue long value) {

    public IncidentId {
        if (value < 0) {
            throw new IllegalArgumentException("incidentId must be non-negative");
        }
    }

    public static IncidentId of(final long value) {
        return new IncidentId(value);
    }

    @Override
    public String toString() {
        return "IncidentId(" + value + ")";
    }
}
