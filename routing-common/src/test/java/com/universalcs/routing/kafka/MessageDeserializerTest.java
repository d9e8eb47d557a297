package com.universalcs.routing.kafka;

import com.universalcs.routing.canonical.Message;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MessageDeserializerTest {

    private final MessageDeserializer deserializer = new MessageDeserializer();

    @Test
    public void testClassifierAttributesAreKept() {
        String json = "{\"id\":\"msg-1\",\"organizationId\":\"org-1\",\"conversationId\":\"conv-1\","
            + "\"content\":{\"text\":\"Where is my order?\"},"
            + "\"sender\":{\"email\":\"Customer@Example.com\"},"
            + "\"classification\":{\"category\":\"orders\",\"urgency\":\"high\","
            + "\"sentiment\":{\"label\":\"negative\",\"score\":-0.6},\"topic\":\"shipping\"}}";

        Message message = deserializer.deserialize("message.routing.in", json.getBytes(StandardCharsets.UTF_8));

        assertEquals("msg-1", message.getId());
        assertEquals("orders", message.getClassification().getCategory());
        assertEquals("negative", message.getClassification().getSentiment().getLabel());
        assertEquals("shipping", message.getClassification().getAttributes().get("topic"));
    }

    @Test
    public void testMalformedPayloadIsRejected() {
        assertThrows(RuntimeException.class,
            () -> deserializer.deserialize("message.routing.in", "{not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testNullPayload() {
        assertNull(deserializer.deserialize("message.routing.in", null));
    }
}
