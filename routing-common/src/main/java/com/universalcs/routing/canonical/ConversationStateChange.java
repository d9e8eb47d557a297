package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.universalcs.routing.canonical.enums.ConversationChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conversation state change requested by a routing action.
 *
 * Published for the conversation service; value is a priority string for
 * PRIORITY changes and a tag list for TAGS changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationStateChange {
    private String conversationId;

    private String organizationId;

    private String messageId;

    private ConversationChangeType changeType;

    private Object value;

    /**
     * ISO 8601 timestamp of when the change was requested.
     */
    private String requestedAt;
}
