package com.universalcs.routing.engine.condition;

import com.universalcs.routing.canonical.Classification;
import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.enums.ConditionOperator;
import com.universalcs.routing.error.ConditionEvaluationException;
import com.universalcs.routing.rules.RoutingCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Evaluates a single routing condition against a message.
 *
 * Actual value by condition type:
 * - content_contains: content text, lower-cased
 * - sender_email: sender email, lower-cased
 * - ai_classification: classification[field], field defaults to "category"
 * - sentiment: classification sentiment label
 * - urgency: classification urgency
 * - time_of_day: current hour (0-23) in the configured zone
 * - custom: dotted path into the message, given by field
 *
 * Only the message side is lower-cased; comparison literals are used verbatim.
 * An absent actual value never matches, whatever the operator. Evaluation
 * never throws: any failure reads as "condition not met".
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final String DEFAULT_CLASSIFICATION_FIELD = "category";

    private final Clock clock;
    private final ZoneId zoneId;
    private final MessagePathResolver pathResolver;

    public ConditionEvaluator(Clock clock, ZoneId zoneId) {
        this(clock, zoneId, new MessagePathResolver());
    }

    public ConditionEvaluator(Clock clock, ZoneId zoneId, MessagePathResolver pathResolver) {
        this.clock = clock;
        this.zoneId = zoneId;
        this.pathResolver = pathResolver;
    }

    /**
     * Evaluate a condition against a message.
     *
     * @param condition condition to check
     * @param message message being routed
     * @return true if the condition holds; false otherwise or on any failure
     */
    public boolean evaluate(RoutingCondition condition, Message message) {
        if (condition == null || message == null) {
            return false;
        }

        try {
            Object actualValue = resolveActualValue(condition, message);
            return applyOperator(actualValue, condition.getOperator(), condition.getValue());
        } catch (RuntimeException e) {
            log.debug("Condition not met after evaluation failure: messageId={}, type={}, operator={}, reason={}",
                message.getId(), condition.getType(), condition.getOperator(), e.getMessage());
            return false;
        }
    }

    private Object resolveActualValue(RoutingCondition condition, Message message) {
        if (condition.getType() == null) {
            throw new ConditionEvaluationException("Unknown condition type");
        }

        Classification classification = message.getClassification();

        switch (condition.getType()) {
            case CONTENT_CONTAINS:
                if (message.getContent() == null || message.getContent().getText() == null) {
                    return null;
                }
                return message.getContent().getText().toLowerCase(Locale.ROOT);

            case SENDER_EMAIL:
                if (message.getSender() == null || message.getSender().getEmail() == null) {
                    return null;
                }
                return message.getSender().getEmail().toLowerCase(Locale.ROOT);

            case AI_CLASSIFICATION:
                String field = isBlank(condition.getField()) ? DEFAULT_CLASSIFICATION_FIELD : condition.getField();
                return pathResolver.resolve(classification, field);

            case SENTIMENT:
                if (classification == null || classification.getSentiment() == null) {
                    return null;
                }
                return classification.getSentiment().getLabel();

            case URGENCY:
                return classification != null ? classification.getUrgency() : null;

            case TIME_OF_DAY:
                return clock.instant().atZone(zoneId).getHour();

            case CUSTOM:
                return pathResolver.resolve(message, condition.getField());

            default:
                throw new ConditionEvaluationException("Unsupported condition type: " + condition.getType());
        }
    }

    private boolean applyOperator(Object actualValue, ConditionOperator operator, Object expectedValue) {
        if (actualValue == null) {
            return false;
        }
        if (operator == null) {
            throw new ConditionEvaluationException("Unknown condition operator");
        }

        switch (operator) {
            case EQUALS:
                return strictEquals(actualValue, expectedValue);

            case CONTAINS:
                return asString(actualValue).contains(asString(expectedValue));

            case STARTS_WITH:
                return asString(actualValue).startsWith(asString(expectedValue));

            case ENDS_WITH:
                return asString(actualValue).endsWith(asString(expectedValue));

            case REGEX:
                return compile(expectedValue).matcher(asString(actualValue)).find();

            case GREATER_THAN:
                return toNumber(actualValue) > toNumber(expectedValue);

            case LESS_THAN:
                return toNumber(actualValue) < toNumber(expectedValue);

            case IN: {
                Collection<?> candidates = asCollection(expectedValue);
                return candidates != null && containsStrict(candidates, actualValue);
            }

            case NOT_IN: {
                Collection<?> candidates = asCollection(expectedValue);
                return candidates != null && !containsStrict(candidates, actualValue);
            }

            default:
                throw new ConditionEvaluationException("Unsupported condition operator: " + operator);
        }
    }

    private Pattern compile(Object expectedValue) {
        try {
            return Pattern.compile(asString(expectedValue));
        } catch (PatternSyntaxException e) {
            throw new ConditionEvaluationException("Invalid pattern: " + expectedValue, e);
        }
    }

    /**
     * Equality without type coercion. Numbers compare by value, so 9 and 9.0
     * are equal, but the string "9" never equals the number 9. Lists and
     * objects read from a message are never equal to a rule literal, even
     * with the same elements.
     */
    private boolean strictEquals(Object actual, Object expected) {
        if (isStructured(actual) || isStructured(expected)) {
            return false;
        }
        if (actual instanceof Number && expected instanceof Number) {
            return ((Number) actual).doubleValue() == ((Number) expected).doubleValue();
        }
        return Objects.equals(actual, expected);
    }

    private boolean isStructured(Object value) {
        return value instanceof Collection || value instanceof Map || value instanceof Object[];
    }

    private boolean containsStrict(Collection<?> candidates, Object actual) {
        for (Object candidate : candidates) {
            if (strictEquals(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private Collection<?> asCollection(Object value) {
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        return null;
    }

    /**
     * String form used by the text operators. Integral numbers print without a
     * fraction and lists join their elements with commas.
     */
    private String asString(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                .map(element -> element == null ? "" : asString(element))
                .collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    /**
     * Numeric form used by greater_than and less_than. Values that do not read
     * as a number become NaN, which compares false both ways.
     */
    private double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        if (value instanceof Collection) {
            Collection<?> collection = (Collection<?>) value;
            if (collection.isEmpty()) {
                return 0;
            }
            if (collection.size() == 1) {
                return toNumber(new ArrayList<>(collection).get(0));
            }
        }
        return Double.NaN;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
