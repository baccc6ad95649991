package com.atlas.core.intent;

import com.atlas.core.model.ClassificationResult;
import com.atlas.core.model.Confidence;
import com.atlas.core.model.IntentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    private final ResponseCatalog catalog = new ResponseCatalog(new Random(42));
    private final IntentClassifier classifier = new IntentClassifier(catalog);

    @Nested
    @DisplayName("Conversational intents")
    class Conversational {

        @ParameterizedTest
        @ValueSource(strings = {"hi", "Hey!", "hello...", "Good morning", "what's up?", "HOWDY"})
        @DisplayName("greetings are recognised with high confidence")
        void greetings(String message) {
            ClassificationResult result = classifier.classify(message);
            assertEquals(IntentType.GREETING, result.intent());
            assertEquals(Confidence.HIGH, result.confidence());
            assertEquals("Empty message", result.reasoning());
            assertFalse(result.shouldExecuteTask());
            assertTrue(catalog.candidatesFor(IntentType.GREETING).contains(result.suggestedResponse()));
        }

        @Test
        @DisplayName("thanks is gratitude")
        void gratitude() {
            assertEquals(IntentType.GRATITUDE, classifier.classify("thanks!").intent());
            assertEquals(IntentType.GRATITUDE, classifier.classify("thanks so much").intent());
        }

        @Test
        @DisplayName("bare 'no' is a negation, not a clarification")
        void negationBeforeClarification() {
            assertEquals(IntentType.NEGATION, classifier.classify("no").intent());
            assertEquals(IntentType.NEGATION, classifier.classify("never mind").intent());
        }

        @Test
        @DisplayName("'good night' is claimed by the greeting rule, which is checked before farewell")
        void goodNight() {
            assertEquals(IntentType.GREETING, classifier.classify("good night").intent());
            assertEquals(IntentType.FAREWELL, classifier.classify("gn").intent());
        }

        @Test
        @DisplayName("affirmation, small talk, agent question and clarification")
        void otherIntents() {
            assertEquals(IntentType.AFFIRMATION, classifier.classify("sounds good").intent());
            assertEquals(IntentType.SMALL_TALK, classifier.classify("how are you?").intent());
            assertEquals(IntentType.AGENT_QUESTION, classifier.classify("what can you do").intent());
            assertEquals(IntentType.AGENT_QUESTION, classifier.classify("help").intent());
            assertEquals(IntentType.CLARIFICATION, classifier.classify("huh?").intent());
        }

        @Test
        @DisplayName("patterns are anchored: extra words fall through to task detection")
        void anchoredPatterns() {
            ClassificationResult result = classifier.classify("hi, can you list the files in my repo");
            assertEquals(IntentType.TASK, result.intent());
            assertEquals(Confidence.HIGH, result.confidence());
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n\t", "\u3000", "\u2003\u2003", " \u2002 "})
        @DisplayName("empty and blank messages are clarification with high confidence")
        void blank(String message) {
            ClassificationResult result = classifier.classify(message);
            assertEquals(IntentType.CLARIFICATION, result.intent());
            assertEquals(Confidence.HIGH, result.confidence());
            assertFalse(result.shouldExecuteTask());
        }

        @Test
        @DisplayName("null is treated like an empty message")
        void nullMessage() {
            assertEquals(IntentType.CLARIFICATION, classifier.classify(null).intent());
        }

        @Test
        @DisplayName("short message without task indicators asks for detail")
        void shortWithoutIndicators() {
            ClassificationResult result = classifier.classify("purple elephant dancing");
            assertEquals(IntentType.CLARIFICATION, result.intent());
            assertEquals(Confidence.MEDIUM, result.confidence());
            assertEquals(IntentClassifier.SHORT_MESSAGE_RESPONSE, result.suggestedResponse());
        }
    }

    @Nested
    @DisplayName("Tasks")
    class Tasks {

        @Test
        @DisplayName("short message with a task indicator is a task")
        void shortWithIndicator() {
            ClassificationResult result = classifier.classify("deploy it");
            assertEquals(IntentType.TASK, result.intent());
            assertEquals(Confidence.HIGH, result.confidence());
            assertTrue(result.shouldExecuteTask());
            assertNull(result.suggestedResponse());
        }

        @Test
        @DisplayName("longer message without indicators is a medium-confidence task")
        void longerWithoutIndicators() {
            ClassificationResult result = classifier.classify("I would love some help with the quarterly numbers");
            assertEquals(IntentType.TASK, result.intent());
            assertEquals(Confidence.MEDIUM, result.confidence());
        }

        @Test
        @DisplayName("isConversational mirrors shouldExecuteTask")
        void isConversational() {
            assertTrue(classifier.isConversational("thanks"));
            assertFalse(classifier.isConversational("restart the api container"));
        }

        @Test
        @DisplayName("describe renders intent, confidence and reasoning")
        void describe() {
            assertEquals("Intent: greeting (high confidence) - Matched greeting pattern",
                    classifier.describe("hello"));
        }
    }
}
