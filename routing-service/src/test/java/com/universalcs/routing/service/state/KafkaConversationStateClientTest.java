package com.universalcs.routing.service.state;

import com.universalcs.routing.canonical.ConversationStateChange;
import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.MessageContent;
import com.universalcs.routing.canonical.enums.ConversationChangeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Conversation state change events published for set_priority and add_tags.
 */
@ExtendWith(MockitoExtension.class)
public class KafkaConversationStateClientTest {

    private static final String TOPIC = "conversation.state.changes";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaConversationStateClient client;
    private Message message;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        client = new KafkaConversationStateClient(kafkaTemplate, TOPIC, clock);
        message = Message.builder()
            .id("msg-1")
            .conversationId("conv-1")
            .organizationId("org-acme")
            .content(MessageContent.ofText("hello"))
            .build();
    }

    @Test
    public void testSetPriorityPublishesPriorityChange() {
        when(kafkaTemplate.send(eq(TOPIC), eq("conv-1"), any())).thenReturn(CompletableFuture.completedFuture(null));

        client.setPriority(message, "urgent");

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("conv-1"), captor.capture());
        ConversationStateChange change = assertInstanceOf(ConversationStateChange.class, captor.getValue());
        assertEquals(ConversationChangeType.PRIORITY, change.getChangeType());
        assertEquals("urgent", change.getValue());
        assertEquals("org-acme", change.getOrganizationId());
        assertEquals("msg-1", change.getMessageId());
        assertEquals("2024-03-01T12:00:00Z", change.getRequestedAt());
    }

    @Test
    public void testAddTagsPublishesTagChange() {
        when(kafkaTemplate.send(eq(TOPIC), eq("conv-1"), any())).thenReturn(CompletableFuture.completedFuture(null));

        client.addTags(message, List.of("billing", "vip"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("conv-1"), captor.capture());
        ConversationStateChange change = assertInstanceOf(ConversationStateChange.class, captor.getValue());
        assertEquals(ConversationChangeType.TAGS, change.getChangeType());
        assertEquals(List.of("billing", "vip"), change.getValue());
    }

    @Test
    public void testFailedPublishIsOnlyLogged() {
        when(kafkaTemplate.send(eq(TOPIC), eq("conv-1"), any()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() -> client.setPriority(message, "high"));
    }
}
