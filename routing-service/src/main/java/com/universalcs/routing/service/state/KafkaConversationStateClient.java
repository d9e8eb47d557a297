package com.universalcs.routing.service.state;

import com.universalcs.routing.canonical.ConversationStateChange;
import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.enums.ConversationChangeType;
import com.universalcs.routing.engine.action.ConversationStateClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Publishes conversation state changes for the conversation service.
 *
 * Fire-and-forget: the send result is only logged. Events are keyed by
 * conversation id so changes to one conversation stay ordered.
 */
@Component
public class KafkaConversationStateClient implements ConversationStateClient {

    private static final Logger log = LoggerFactory.getLogger(KafkaConversationStateClient.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final Clock clock;

    public KafkaConversationStateClient(KafkaTemplate<String, Object> kafkaTemplate,
                                        @Value("${routing.topics.conversation-state:conversation.state.changes}") String topic,
                                        Clock routingClock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.clock = routingClock;
    }

    @Override
    public void setPriority(Message message, String priority) {
        publish(message, ConversationChangeType.PRIORITY, priority);
    }

    @Override
    public void addTags(Message message, List<String> tags) {
        publish(message, ConversationChangeType.TAGS, new ArrayList<>(tags));
    }

    private void publish(Message message, ConversationChangeType changeType, Object value) {
        ConversationStateChange change = ConversationStateChange.builder()
            .conversationId(message.getConversationId())
            .organizationId(message.getOrganizationId())
            .messageId(message.getId())
            .changeType(changeType)
            .value(value)
            .requestedAt(Instant.now(clock).toString())
            .build();

        kafkaTemplate.send(topic, message.getConversationId(), change).whenComplete((result, exception) -> {
            if (exception != null) {
                log.error("Failed to publish conversation state change - conversationId={}, change={}",
                    message.getConversationId(), changeType, exception);
            } else {
                log.info("Published conversation state change - conversationId={}, change={}, value={}, topic={}",
                    message.getConversationId(), changeType, value, topic);
            }
        });
    }
}
