package com.workhub.core.classify;

import com.workhub.core.llm.LlmProperties;
import com.workhub.core.llm.LlmService;
import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies a message with the external language model.
 * <p>
 * The model is asked to reply with exactly {@code label|confidence}. A reply is
 * accepted only when the label is one of the six known intents and the
 * confidence parses as a number in {@code [0, 1]}; everything else, including
 * call failures, becomes a {@link ModelResult.Err}.
 */
@Component
public class ModelIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(ModelIntentClassifier.class);

    /** Plain decimal only; no sign, exponent, hex or type suffix. */
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d*\\.?\\d+");

    static final String PROMPT_TEMPLATE = """
            You are a WorkHub AI assistant analyzing worker messages. Classify this message into the MOST APPROPRIATE category:

            CATEGORIES:
            • task_update: Work progress, completion, repairs, installations, material needs
            • incident_report: Safety issues, accidents, equipment failures, emergencies, broken items
            • permission_request: Requests for access, approval, authorization, overtime, leave
            • attendance: Check-in/out, breaks, location updates, shift changes
            • question: Asking for help, instructions, clarification, how-to questions
            • general: Casual conversation or unclear intent

            EXAMPLES:
            "pipe is broken" → incident_report|0.9
            "finished the repair" → task_update|0.9
            "need overtime approval" → permission_request|0.9
            "checked in at site" → attendance|0.9
            "how do I use this?" → question|0.9

            Message: "%s"

            Respond ONLY with: CATEGORY|CONFIDENCE (0.0-1.0)
            """;

    private final LlmService llmService;
    private final double temperature;

    public ModelIntentClassifier(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.temperature = properties.classificationTemperature();
    }

    public boolean isAvailable() {
        return llmService.isAvailable();
    }

    public ModelResult<ClassificationResult> classify(String message) {
        String reply;
        try {
            reply = llmService.complete(PROMPT_TEMPLATE.formatted(message == null ? "" : message), temperature);
        } catch (RuntimeException e) {
            ModelError error = ModelError.from(e);
            log.warn("Model classification failed ({}): {}", error, e.getMessage());
            return ModelResult.err(error, e.getMessage());
        }
        return parseReply(reply);
    }

    /**
     * Parses a {@code label|confidence} reply. Tolerates surrounding whitespace,
     * a trailing period and upper-case labels.
     */
    static ModelResult<ClassificationResult> parseReply(String reply) {
        if (reply == null || reply.isBlank()) {
            return ModelResult.err(ModelError.EMPTY_RESPONSE, "blank reply");
        }
        String[] parts = reply.strip().split("\\|");
        if (parts.length != 2) {
            return ModelResult.err(ModelError.MALFORMED_RESPONSE, "expected label|confidence but got: " + reply);
        }
        Optional<Intent> intent = Intent.fromLabel(parts[0]);
        if (intent.isEmpty()) {
            return ModelResult.err(ModelError.UNKNOWN_LABEL, "unknown label: " + parts[0].strip());
        }
        String rawConfidence = parts[1].strip();
        if (rawConfidence.endsWith(".")) {
            rawConfidence = rawConfidence.substring(0, rawConfidence.length() - 1);
        }
        if (!PLAIN_DECIMAL.matcher(rawConfidence).matches()) {
            return ModelResult.err(ModelError.MALFORMED_RESPONSE, "confidence is not a decimal number: " + rawConfidence);
        }
        double confidence = Double.parseDouble(rawConfidence);
        if (confidence > 1.0) {
            return ModelResult.err(ModelError.MALFORMED_RESPONSE, "confidence out of range: " + confidence);
        }
        return ModelResult.ok(new ClassificationResult(intent.get(), confidence));
    }
}
