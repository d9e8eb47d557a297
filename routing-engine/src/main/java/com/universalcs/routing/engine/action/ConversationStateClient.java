package com.universalcs.routing.engine.action;

import com.universalcs.routing.canonical.Message;

import java.util.List;

/**
 * Conversation service collaborator notified by set_priority and add_tags.
 *
 * Notification is fire-and-forget: returning means the change was handed
 * off, not that the conversation was updated.
 */
public interface ConversationStateClient {

    void setPriority(Message message, String priority);

    void addTags(Message message, List<String> tags);
}
