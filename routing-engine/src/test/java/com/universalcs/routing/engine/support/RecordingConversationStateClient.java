package com.universalcs.routing.engine.support;

import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.engine.action.ConversationStateClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Records priority and tag changes in call order.
 */
public class RecordingConversationStateClient implements ConversationStateClient {

    private final List<String> priorities = new ArrayList<>();
    private final List<List<String>> tagChanges = new ArrayList<>();

    @Override
    public void setPriority(Message message, String priority) {
        priorities.add(priority);
    }

    @Override
    public void addTags(Message message, List<String> tags) {
        tagChanges.add(tags);
    }

    public List<String> getPriorities() {
        return priorities;
    }

    public List<List<String>> getTagChanges() {
        return tagChanges;
    }
}
