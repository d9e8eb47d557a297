package com.universalcs.routing.service.listener;

import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.MessageContent;
import com.universalcs.routing.canonical.RoutingResult;
import com.universalcs.routing.engine.RuleEngine;
import com.universalcs.routing.error.RuleLoadException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Inbound routing: results, deferral on rule load failure and skipped records.
 */
@ExtendWith(MockitoExtension.class)
public class MessageRoutingListenerTest {

    private static final String RESULTS = "message.routing.results";
    private static final String DEFERRED = "message.routing.deferred";

    private static ValidatorFactory validatorFactory;

    @Mock
    private RuleEngine ruleEngine;

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Mock
    private Acknowledgment acknowledgment;

    private MessageRoutingListener listener;
    private Message message;

    @BeforeAll
    public static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    public static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    public void setUp() {
        Validator validator = validatorFactory.getValidator();
        listener = new MessageRoutingListener(ruleEngine, kafkaTemplate, validator, RESULTS, DEFERRED, 200);
        message = Message.builder()
            .id("msg-1")
            .conversationId("conv-1")
            .organizationId("org-acme")
            .content(MessageContent.ofText("My order never arrived"))
            .build();
    }

    @Test
    public void testRoutedMessagePublishesResultAndAcknowledges() throws Exception {
        RoutingResult result = RoutingResult.builder()
            .messageId("msg-1")
            .organizationId("org-acme")
            .appliedRules(List.of("rule-1"))
            .build();
        when(ruleEngine.route(message)).thenReturn(result);
        when(kafkaTemplate.send(RESULTS, "msg-1", result)).thenReturn(CompletableFuture.completedFuture(null));

        listener.onMessage(record(message), acknowledgment);

        verify(kafkaTemplate).send(RESULTS, "msg-1", result);
        verify(acknowledgment).acknowledge();
    }

    @Test
    public void testRuleLoadFailureDefersMessage() throws Exception {
        when(ruleEngine.route(message)).thenThrow(new RuleLoadException("org-acme", "Rule store unavailable"));
        when(kafkaTemplate.send(DEFERRED, "msg-1", message)).thenReturn(CompletableFuture.completedFuture(null));

        listener.onMessage(record(message), acknowledgment);

        verify(kafkaTemplate).send(DEFERRED, "msg-1", message);
        verify(kafkaTemplate, never()).send(RESULTS, "msg-1", message);
        verify(acknowledgment).acknowledge();
    }

    @Test
    public void testFailedDeferralLeavesRecordForRedelivery() throws Exception {
        when(ruleEngine.route(message)).thenThrow(new RuleLoadException("org-acme", "Rule store unavailable"));
        when(kafkaTemplate.send(DEFERRED, "msg-1", message))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        listener.onMessage(record(message), acknowledgment);

        verify(acknowledgment).nack(MessageRoutingListener.REDELIVERY_BACKOFF);
        verify(acknowledgment, never()).acknowledge();
    }

    @Test
    public void testInvalidMessageIsSkipped() throws Exception {
        message.setOrganizationId(" ");

        listener.onMessage(record(message), acknowledgment);

        verify(ruleEngine, never()).route(any());
        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
        verify(acknowledgment).acknowledge();
    }

    @Test
    public void testEmptyRecordIsSkipped() {
        listener.onMessage(record(null), acknowledgment);

        verifyNoInteractions(ruleEngine, kafkaTemplate);
        verify(acknowledgment).acknowledge();
    }

    private ConsumerRecord<String, Message> record(Message value) {
        return new ConsumerRecord<>("message.routing.in", 0, 42L, value != null ? value.getId() : null, value);
    }
}
