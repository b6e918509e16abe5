// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders events as JSON envelopes of the form {@code {"event": name, "data": {...}}}.
 *
 * <p>Value types serialize through their {@code @JsonValue} accessors: addresses and
 * hashes as hex strings, agent ids as numbers.
 *
 * <pre>{@code
 * ledger.addListener(event -> publisher.send(codec.toJson(event)));
 * }</pre>
 */
public final class EventCodec {

    private final ObjectMapper mapper;

    public EventCodec() {
        this(new ObjectMapper());
    }

    public EventCodec(final ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectNode toNode(final LedgerEvent event) {
        Objects.requireNonNull(event, "event");
        final ObjectNode envelope = mapper.createObjectNode();
        envelope.put("event", event.name());
        envelope.set("data", mapper.valueToTree(event));
        return envelope;
    }

    /**
     * Serializes an event envelope.
     *
     * @param event the event
     * @return compact JSON
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public String toJson(final LedgerEvent event) {
        try {
            return mapper.writeValueAsString(toNode(event));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.name() + ": " + e.getMessage(), e);
        }
    }
}
