package com.universalcs.routing.engine.condition;

import com.universalcs.routing.canonical.Message;
import com.universalcs.routing.canonical.enums.ConditionOperator;
import com.universalcs.routing.canonical.enums.ConditionType;
import com.universalcs.routing.engine.support.MutableClock;
import com.universalcs.routing.rules.RoutingCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.universalcs.routing.engine.support.TestMessages.condition;
import static com.universalcs.routing.engine.support.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Condition evaluation: field derivation, operator semantics and the
 * absent-value guard.
 */
public class ConditionEvaluatorTest {

    private MutableClock clock;
    private ConditionEvaluator evaluator;
    private Message message;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T14:30:00Z"));
        evaluator = new ConditionEvaluator(clock, ZoneOffset.UTC);
        message = message("This is an URGENT issue");
        message.getMetadata().put("channel", "email");
        message.getMetadata().put("orderCount", 15);
        message.getMetadata().put("score", "abc");
    }

    @Test
    public void testContentIsLowerCasedButLiteralIsNot() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CONTENT_CONTAINS, ConditionOperator.CONTAINS, "urgent"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CONTENT_CONTAINS, ConditionOperator.CONTAINS, "URGENT"), message));
    }

    @Test
    public void testSenderEmailIsLowerCased() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.SENDER_EMAIL, ConditionOperator.ENDS_WITH, "@example.com"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.SENDER_EMAIL, ConditionOperator.EQUALS, "jane.doe@example.com"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.SENDER_EMAIL, ConditionOperator.STARTS_WITH, "Jane"), message));
    }

    @Test
    public void testClassificationFieldDefaultsToCategory() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.AI_CLASSIFICATION, ConditionOperator.EQUALS, "billing"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.AI_CLASSIFICATION, ConditionOperator.EQUALS, "refund_request", "intent"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.AI_CLASSIFICATION, ConditionOperator.EQUALS, "negative", "sentiment.label"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.AI_CLASSIFICATION, ConditionOperator.EQUALS, "billing", "missing"), message));
    }

    @Test
    public void testSentimentAndUrgency() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.SENTIMENT, ConditionOperator.EQUALS, "negative"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.URGENCY, ConditionOperator.IN, List.of("high", "critical")), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.URGENCY, ConditionOperator.NOT_IN, List.of("low", "medium")), message));
    }

    @Test
    public void testTimeOfDayUsesConfiguredZone() {
        RoutingCondition afterNine = condition(ConditionType.TIME_OF_DAY, ConditionOperator.GREATER_THAN, 9);
        RoutingCondition atFourteen = condition(ConditionType.TIME_OF_DAY, ConditionOperator.EQUALS, 14);

        assertTrue(evaluator.evaluate(afterNine, message));
        assertTrue(evaluator.evaluate(atFourteen, message));

        ConditionEvaluator newYork = new ConditionEvaluator(clock, ZoneId.of("America/New_York"));
        assertFalse(newYork.evaluate(afterNine, message));
        assertTrue(newYork.evaluate(condition(ConditionType.TIME_OF_DAY, ConditionOperator.EQUALS, 9), message));

        clock.setInstant(Instant.parse("2024-03-01T20:00:00Z"));
        assertFalse(evaluator.evaluate(condition(ConditionType.TIME_OF_DAY, ConditionOperator.LESS_THAN, 17), message));
    }

    @Test
    public void testCustomFieldReadsDottedPath() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, "email", "metadata.channel"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, "conv-1", "conversationId"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, "email", null), message));
    }

    @Test
    public void testInAndNotInRequireArrayValue() {
        assertFalse(evaluator.evaluate(
            condition(ConditionType.URGENCY, ConditionOperator.IN, "high"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.URGENCY, ConditionOperator.NOT_IN, "low"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.URGENCY, ConditionOperator.IN, new String[] {"high"}), message));
    }

    @Test
    public void testAbsentValueIsFalseForEveryOperator() {
        Message unclassified = message("hello");
        unclassified.setClassification(null);
        unclassified.setContent(null);

        for (ConditionOperator operator : ConditionOperator.values()) {
            assertFalse(evaluator.evaluate(condition(ConditionType.URGENCY, operator, List.of("x")), unclassified),
                "urgency " + operator.getValue());
            assertFalse(evaluator.evaluate(condition(ConditionType.CONTENT_CONTAINS, operator, ""), unclassified),
                "content " + operator.getValue());
            assertFalse(evaluator.evaluate(condition(ConditionType.CUSTOM, operator, "x", "metadata.none"), unclassified),
                "custom " + operator.getValue());
        }
    }

    @Test
    public void testRegexMatchesAndMalformedPatternIsFalse() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CONTENT_CONTAINS, ConditionOperator.REGEX, "^this.*issue$"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CONTENT_CONTAINS, ConditionOperator.REGEX, "(["), message));
    }

    @Test
    public void testNumericComparisonsCoerceBothSides() {
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.GREATER_THAN, "3", "metadata.orderCount"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.LESS_THAN, 20.5, "metadata.orderCount"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.GREATER_THAN, 1, "metadata.score"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.LESS_THAN, 1, "metadata.score"), message));
    }

    @Test
    public void testEqualsIsStrictAndStringOperatorsCoerce() {
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, "15", "metadata.orderCount"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, 15.0, "metadata.orderCount"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.CONTAINS, 5, "metadata.orderCount"), message));
    }

    @Test
    public void testListAndObjectValuesNeverEqualALiteral() {
        message.getMetadata().put("labels", List.of("a"));
        message.getMetadata().put("address", Map.of("city", "Austin"));

        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, List.of("a"), "metadata.labels"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.IN, List.of(List.of("a")), "metadata.labels"), message));
        assertFalse(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, Map.of("city", "Austin"), "metadata.address"),
            message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.EQUALS, "a", "metadata.labels.0"), message));
        assertTrue(evaluator.evaluate(
            condition(ConditionType.CUSTOM, ConditionOperator.CONTAINS, "a", "metadata.labels"), message));
    }

    @Test
    public void testUnknownTypeOrOperatorIsFalse() {
        assertFalse(evaluator.evaluate(condition(null, ConditionOperator.EQUALS, "x"), message));
        assertFalse(evaluator.evaluate(condition(ConditionType.URGENCY, null, "high"), message));
        assertFalse(evaluator.evaluate(null, message));
    }
}
