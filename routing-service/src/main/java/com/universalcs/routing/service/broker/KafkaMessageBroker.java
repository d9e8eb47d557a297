package com.universalcs.routing.service.broker;

import com.universalcs.routing.broker.MessageBroker;
import com.universalcs.routing.broker.WorkItem;
import com.universalcs.routing.broker.WorkQueue;
import com.universalcs.routing.error.BrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Message broker backed by Kafka. Each work queue is a topic of the same name
 * (routing.assignment, webhook.delivery, message.delivery), keyed by work item id.
 *
 * submit waits for the Kafka acknowledgement, bounded by
 * routing.broker.submit-timeout-ms, and never for the work itself.
 */
@Component
public class KafkaMessageBroker implements MessageBroker {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageBroker.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final long submitTimeoutMs;

    public KafkaMessageBroker(KafkaTemplate<String, Object> kafkaTemplate,
                              @Value("${routing.broker.submit-timeout-ms:5000}") long submitTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.submitTimeoutMs = submitTimeoutMs;
    }

    @Override
    public void submit(WorkQueue queue, WorkItem workItem) {
        String topic = queue.getValue();
        try {
            SendResult<String, Object> result = kafkaTemplate.send(topic, workItem.getId(), workItem)
                .get(submitTimeoutMs, TimeUnit.MILLISECONDS);

            if (result != null && result.getRecordMetadata() != null) {
                log.info("Submitted work item - id={}, type={}, topic={}, partition={}, offset={}",
                    workItem.getId(), workItem.getType(), topic,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            } else {
                log.info("Submitted work item - id={}, type={}, topic={}", workItem.getId(), workItem.getType(), topic);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted while submitting work item " + workItem.getId() + " to " + topic, e);
        } catch (ExecutionException e) {
            log.error("Failed to submit work item - id={}, topic={}", workItem.getId(), topic, e.getCause());
            throw new BrokerException("Failed to submit work item " + workItem.getId() + " to " + topic, e.getCause());
        } catch (TimeoutException e) {
            log.error("Timed out submitting work item - id={}, topic={}, timeoutMs={}",
                workItem.getId(), topic, submitTimeoutMs);
            throw new BrokerException("Timed out after " + submitTimeoutMs + "ms submitting work item "
                + workItem.getId() + " to " + topic, e);
        } catch (RuntimeException e) {
            log.error("Error submitting work item - id={}, topic={}", workItem.getId(), topic, e);
            throw new BrokerException("Error submitting work item " + workItem.getId() + " to " + topic, e);
        }
    }
}
