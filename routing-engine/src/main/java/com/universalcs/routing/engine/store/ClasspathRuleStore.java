package com.universalcs.routing.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalcs.routing.error.RuleLoadException;
import com.universalcs.routing.json.RoutingObjectMappers;
import com.universalcs.routing.rules.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads routing rules from a classpath JSON document.
 *
 * Document format:
 * <pre>
 * { "version": "1.0", "rules": [ { "id": ..., "organizationId": ..., ... } ] }
 * </pre>
 *
 * The document is re-read on every load so that a reload after cache expiry
 * sees the current file. Rules keep their document order; they are not
 * sorted by priority. Only the requested organization's rules are bound to
 * {@link RoutingRule}, and a rule that cannot be bound is skipped with a
 * warning, so a bad rule never affects another organization.
 *
 * This class is thread-safe.
 */
public class ClasspathRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(ClasspathRuleStore.class);
    public static final String DEFAULT_RULES_PATH = "/config/routing_rules.json";

    private final String classpathPath;
    private final ObjectMapper objectMapper;

    public ClasspathRuleStore() {
        this(DEFAULT_RULES_PATH);
    }

    public ClasspathRuleStore(String classpathPath) {
        this(classpathPath, RoutingObjectMappers.create());
    }

    public ClasspathRuleStore(String classpathPath, ObjectMapper objectMapper) {
        this.classpathPath = classpathPath;
        this.objectMapper = objectMapper;
    }

    /**
     * Load the rules of one organization from the classpath document.
     *
     * @param organizationId owning tenant
     * @return rules whose organizationId equals the given one, in document order
     * @throws RuleLoadException if the document is missing or is not valid JSON
     */
    @Override
    public List<RoutingRule> loadRules(String organizationId) throws RuleLoadException {
        JsonNode document = readDocument(organizationId);

        List<RoutingRule> rules = new ArrayList<>();
        JsonNode ruleNodes = document == null ? null : document.get("rules");
        if (ruleNodes != null && ruleNodes.isArray()) {
            for (JsonNode ruleNode : ruleNodes) {
                if (!belongsTo(ruleNode, organizationId)) {
                    continue;
                }
                RoutingRule rule = toRule(ruleNode, organizationId);
                if (rule != null) {
                    rules.add(rule);
                }
            }
        }

        log.info("Loaded {} routing rules for organization {} from {}",
            rules.size(), organizationId, classpathPath);

        return rules;
    }

    private boolean belongsTo(JsonNode ruleNode, String organizationId) {
        if (ruleNode == null || !ruleNode.isObject()) {
            return false;
        }
        JsonNode owner = ruleNode.get("organizationId");
        return owner != null && owner.isTextual() && Objects.equals(organizationId, owner.textValue());
    }

    private RoutingRule toRule(JsonNode ruleNode, String organizationId) {
        try {
            return objectMapper.treeToValue(ruleNode, RoutingRule.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable routing rule: organizationId={}, ruleId={}, reason={}",
                organizationId, ruleNode.path("id").asText("<none>"), e.getMessage());
            return null;
        }
    }

    private JsonNode readDocument(String organizationId) throws RuleLoadException {
        try (InputStream inputStream = getClass().getResourceAsStream(classpathPath)) {
            if (inputStream == null) {
                throw new RuleLoadException(organizationId,
                    "Routing rules file not found in classpath: " + classpathPath);
            }
            return objectMapper.readTree(inputStream);
        } catch (IOException e) {
            log.error("Failed to load routing rules from: {}", classpathPath, e);
            throw new RuleLoadException(organizationId, "Failed to load routing rules from " + classpathPath, e);
        }
    }
}
