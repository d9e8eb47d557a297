package com.universalcs.routing.canonical;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Classification attached to a message by the upstream AI classifier.
 *
 * Besides the well-known fields, classifiers may emit model-specific
 * attributes (e.g. language, topic). Those land in attributes and are
 * reachable by ai_classification conditions through their field name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Classification {
    private String category;

    private String intent;

    private Sentiment sentiment;

    /**
     * low, normal, high, urgent or critical.
     */
    private String urgency;

    private Double confidence;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        if (attributes == null) {
            attributes = new HashMap<>();
        }
        attributes.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
