package com.universalcs.routing.broker;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Unit of deferred work handed to the message broker.
 *
 * Submission success does not mean completion. Workers increment attempts and
 * give up after maxAttempts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkItem {
    /**
     * Work item identifier, e.g. webhook-{messageId}-{epochMillis}.
     */
    @NotBlank
    private String id;

    /**
     * Work type, e.g. message.assign, webhook.trigger, message.auto_response.
     */
    @NotBlank
    private String type;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    private Instant timestamp;

    private int attempts;

    private int maxAttempts;
}
