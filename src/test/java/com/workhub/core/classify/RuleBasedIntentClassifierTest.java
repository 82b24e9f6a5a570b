package com.workhub.core.classify;

import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.Intent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedIntentClassifierTest {

    private final RuleBasedIntentClassifier classifier = new RuleBasedIntentClassifier();

    @Nested
    @DisplayName("sample messages")
    class Samples {

        @Test
        @DisplayName("gas leak is an incident with the specificity bonus")
        void gasLeak() {
            ClassificationResult result = classifier.classify("There's a gas leak in the basement - urgent!");
            assertEquals(Intent.INCIDENT_REPORT, result.intent());
            // leak + urgent groups (2 of 9) plus bonus
            assertEquals(2.0 / 9 + 0.3, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("finished repair is a task update")
        void finishedRepair() {
            ClassificationResult result = classifier.classify("Just finished the plumbing repair in Building A");
            assertEquals(Intent.TASK_UPDATE, result.intent());
            assertEquals(2.0 / 9 + 0.3, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("overtime approval is a permission request")
        void overtime() {
            ClassificationResult result = classifier.classify("Can I get approval for overtime this weekend?");
            assertEquals(Intent.PERMISSION_REQUEST, result.intent());
            assertEquals(3.0 / 7 + 0.3, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("how-to question is a question")
        void question() {
            ClassificationResult result = classifier.classify("How do I operate the new machine?");
            assertEquals(Intent.QUESTION, result.intent());
        }
    }

    @Nested
    @DisplayName("fallback result")
    class Fallback {

        @Test
        @DisplayName("empty text yields general 0.5")
        void emptyText() {
            assertEquals(ClassificationResult.unmatched(), classifier.classify(""));
        }

        @Test
        @DisplayName("null text yields general 0.5")
        void nullText() {
            assertEquals(new ClassificationResult(Intent.GENERAL, 0.5), classifier.classify(null));
        }

        @Test
        @DisplayName("text matching nothing yields general 0.5")
        void noMatch() {
            assertEquals(ClassificationResult.unmatched(), classifier.classify("zzz qqq"));
        }

        @Test
        @DisplayName("non-ASCII text falls back without throwing")
        void nonAscii() {
            ClassificationResult result = assertDoesNotThrow(() -> classifier.classify("İş güvenliği sorunu 🔥 ß ŉ ǰ"));
            assertEquals(ClassificationResult.unmatched(), result);
        }

        @Test
        @DisplayName("keywords are still found next to non-ASCII text")
        void nonAsciiAroundKeywords() {
            ClassificationResult result = classifier.classify("🔥 gas leak near Müllerstraße, urgent!");
            assertEquals(Intent.INCIDENT_REPORT, result.intent());
            assertTrue(result.confidence() > 0.0 && result.confidence() <= 0.95);
        }
    }

    @Test
    @DisplayName("confidence is capped at 0.95")
    void capped() {
        ClassificationResult result = classifier.classify(
                "Urgent emergency: gas leak and fire, pipe broken, someone injured, unsafe hazard, "
                        + "incident with electrical problem and security breach unauthorized access");
        assertEquals(Intent.INCIDENT_REPORT, result.intent());
        assertEquals(0.95, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("equal scores go to the intent declared first")
    void tieBreak() {
        // task update and incident report both have nine groups; one hit each, no specific match
        ClassificationResult result = classifier.classify("work problem");
        assertEquals(Intent.TASK_UPDATE, result.intent());
        assertEquals(1.0 / 9, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("matching ignores case")
    void caseInsensitive() {
        assertEquals(classifier.classify("gas leak URGENT"), classifier.classify("GAS LEAK urgent"));
    }

    @Test
    @DisplayName("classification is deterministic")
    void deterministic() {
        String text = "Checked in at site B this morning";
        assertEquals(classifier.classify(text), classifier.classify(text));
    }
}
