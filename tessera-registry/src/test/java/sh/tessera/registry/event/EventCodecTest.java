// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.FeedbackValue;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.reputation.Sentiment;
import sh.tessera.registry.validation.ValidationStatus;

class EventCodecTest {

    private static final Address OWNER = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    private static final Hash REQUEST = new Hash("0x" + "ab".repeat(32));

    private final EventCodec codec = new EventCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void envelopeCarriesEventNameAndFlatData() {
        ObjectNode node = codec.toNode(new AgentRegistered(AgentId.of(7), OWNER, "ipfs://a", 1_700_000_000L));

        assertEquals("AgentRegistered", node.get("event").asText());
        JsonNode data = node.get("data");
        assertEquals(7, data.get("agentId").asInt());
        assertEquals(OWNER.value(), data.get("owner").asText());
        assertEquals("ipfs://a", data.get("agentUri").asText());
        assertEquals(1_700_000_000L, data.get("timestamp").asLong());
        assertFalse(data.has("name"));
    }

    @Test
    void nullableFieldsSerializeAsNull() throws Exception {
        String json = codec.toJson(new ValidationResolved(REQUEST, ValidationStatus.CANCELLED, OWNER, null, "", "",
                null, 5L));

        JsonNode data = mapper.readTree(json).get("data");
        assertEquals(REQUEST.value(), data.get("requestId").asText());
        assertEquals("CANCELLED", data.get("status").asText());
        assertTrue(data.get("outcome").isNull());
        assertTrue(data.get("resultHash").isNull());
    }

    @Test
    void feedbackScoreKeepsValueAndDecimals() throws Exception {
        FeedbackSubmitted event = new FeedbackSubmitted(AgentId.of(1), OWNER, 3, "ok", Sentiment.POSITIVE,
                FeedbackValue.of(-125, 2), "latency", "", "", "", null, 9L);

        JsonNode data = mapper.readTree(codec.toJson(event)).get("data");

        assertEquals(3, data.get("feedbackIndex").asLong());
        assertEquals("POSITIVE", data.get("sentiment").asText());
        assertEquals(-125, data.get("score").get("value").asInt());
        assertEquals(2, data.get("score").get("decimals").asInt());
    }

    @Test
    void eventNamesMatchRecordNames() {
        assertEquals("OperatorApproval", new OperatorApproval(OWNER, OWNER, true).name());
        assertEquals("AgentDeactivated", new AgentDeactivated(AgentId.of(1), 0L).name());
    }
}
