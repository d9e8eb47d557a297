package com.universalcs.routing.service.listener;

import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.RoutingResult;
import com.universalcs.routing.engine.RuleEngine;
import com.universalcs.routing.error.RuleLoadException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Routes classified messages consumed from message.routing.in.
 *
 * Flow:
 * 1. Validate the message (id and organizationId required); invalid messages are skipped
 * 2. Route it through the {@link RuleEngine}
 * 3. Publish the RoutingResult to message.routing.results, keyed by message id
 * 4. If the rules cannot be loaded, re-publish the message to message.routing.deferred
 *
 * The record is acknowledged once the message was routed, deferred or skipped.
 * When even the deferred publish fails the record is not acknowledged and is
 * redelivered, so a message is never dropped.
 */
@Component
public class MessageRoutingListener {

    private static final Logger log = LoggerFactory.getLogger(MessageRoutingListener.class);

    static final Duration REDELIVERY_BACKOFF = Duration.ofSeconds(5);

    private final RuleEngine ruleEngine;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Validator validator;
    private final String resultsTopic;
    private final String deferredTopic;
    private final long publishTimeoutMs;

    public MessageRoutingListener(RuleEngine ruleEngine,
                                  KafkaTemplate<String, Object> kafkaTemplate,
                                  Validator validator,
                                  @Value("${routing.topics.results:message.routing.results}") String resultsTopic,
                                  @Value("${routing.topics.deferred:message.routing.deferred}") String deferredTopic,
                                  @Value("${routing.broker.submit-timeout-ms:5000}") long publishTimeoutMs) {
        this.ruleEngine = ruleEngine;
        this.kafkaTemplate = kafkaTemplate;
        this.validator = validator;
        this.resultsTopic = resultsTopic;
        this.deferredTopic = deferredTopic;
        this.publishTimeoutMs = publishTimeoutMs;
    }

    @KafkaListener(topics = "${routing.topics.inbound:message.routing.in}",
        groupId = "${kafka.consumer.group-id:message-routing-group}")
    public void onMessage(ConsumerRecord<String, Message> record, Acknowledgment acknowledgment) {
        Message message = record.value();

        if (message == null) {
            log.warn("Skipping empty record - topic={}, partition={}, offset={}",
                record.topic(), record.partition(), record.offset());
            acknowledgment.acknowledge();
            return;
        }

        Set<ConstraintViolation<Message>> violations = validator.validate(message);
        if (!violations.isEmpty()) {
            String reasons = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            log.warn("Skipping invalid message - messageId={}, offset={}, violations=[{}]",
                message.getId(), record.offset(), reasons);
            acknowledgment.acknowledge();
            return;
        }

        try {
            RoutingResult result = ruleEngine.route(message);
            publishResult(result);
            acknowledgment.acknowledge();
        } catch (RuleLoadException e) {
            log.error("Routing deferred, rules unavailable - messageId={}, organizationId={}",
                message.getId(), e.getOrganizationId(), e);
            defer(message, acknowledgment);
        }
    }

    private void publishResult(RoutingResult result) {
        kafkaTemplate.send(resultsTopic, result.getMessageId(), result).whenComplete((sendResult, exception) -> {
            if (exception != null) {
                log.error("Failed to publish routing result - messageId={}", result.getMessageId(), exception);
            } else {
                log.info("Published routing result - messageId={}, appliedRules={}, topic={}",
                    result.getMessageId(), result.getAppliedRules(), resultsTopic);
            }
        });
    }

    private void defer(Message message, Acknowledgment acknowledgment) {
        try {
            kafkaTemplate.send(deferredTopic, message.getId(), message).get(publishTimeoutMs, TimeUnit.MILLISECONDS);
            log.info("Published deferred message - messageId={}, topic={}", message.getId(), deferredTopic);
            acknowledgment.acknowledge();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted deferring message - messageId={}", message.getId(), e);
            acknowledgment.nack(REDELIVERY_BACKOFF);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("Failed to defer message, leaving it for redelivery - messageId={}", message.getId(), e);
            acknowledgment.nack(REDELIVERY_BACKOFF);
        }
    }
}
