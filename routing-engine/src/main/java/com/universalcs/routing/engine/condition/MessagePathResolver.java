package com.universalcs.routing.engine.condition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalcs.routing.error.ConditionEvaluationException;
import com.universalcs.routing.json.RoutingObjectMappers;

/**
 * Resolves dotted paths (e.g. "metadata.channel", "sentiment.label") against
 * the JSON view of a message or classification.
 *
 * Array elements are addressed by numeric segments ("tags.0"). Missing
 * segments and JSON nulls resolve to null.
 */
public class MessagePathResolver {

    private final ObjectMapper objectMapper;

    public MessagePathResolver() {
        this(RoutingObjectMappers.create());
    }

    public MessagePathResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param root object to read from
     * @param path dotted path
     * @return value at path as String, Number, Boolean, List or Map; null when absent
     */
    public Object resolve(Object root, String path) {
        if (root == null || path == null || path.isEmpty()) {
            return null;
        }

        JsonNode node = objectMapper.valueToTree(root);
        for (String part : path.split("\\.", -1)) {
            if (isAbsent(node)) {
                return null;
            }
            node = node.isArray() ? arrayElement(node, part) : node.get(part);
        }

        if (isAbsent(node)) {
            return null;
        }

        try {
            return objectMapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new ConditionEvaluationException("Unreadable value at path: " + path, e);
        }
    }

    private JsonNode arrayElement(JsonNode array, String part) {
        try {
            return array.get(Integer.parseInt(part));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
