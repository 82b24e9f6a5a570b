package com.workhub.core.response;

import com.workhub.core.classify.ModelError;
import com.workhub.core.classify.ModelResult;
import com.workhub.core.config.AgentProperties;
import com.workhub.core.llm.LlmProperties;
import com.workhub.core.llm.LlmService;
import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.EntityCategory;
import com.workhub.core.model.EntitySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Produces the reply shown to the worker.
 * <p>
 * Asks the model for a contextual reply when it is available and has not already
 * failed in this run; any failure or blank reply falls back to
 * {@link FallbackResponseWriter}. Low-confidence results get the review notice appended.
 */
@Component
public class ResponseComposer {

    private static final Logger log = LoggerFactory.getLogger(ResponseComposer.class);

    static final String PROMPT_TEMPLATE = """
            You are WorkHub AI Assistant helping field workers. Generate a helpful, professional response.

            WORKER MESSAGE: "%s"
            DETECTED INTENT: %s (confidence: %s)
            CONTEXT: %s

            GUIDELINES:
            • Be specific to their actual message content
            • Acknowledge what action you're taking based on intent
            • Be encouraging and supportive
            • Keep it concise (1-2 sentences max)
            • Use appropriate emojis for clarity
            • Show you understand their specific situation

            RESPONSE EXAMPLES BY INTENT:
            task_update: "✅ Great work on [specific task]! I've logged your progress and updated the system."
            incident_report: "🚨 Incident recorded immediately! Manager notified. Please prioritize your safety."
            permission_request: "📋 Request submitted for approval! Your manager will review and respond soon."
            attendance: "✅ Successfully logged! Welcome to [location]. Have a productive day!"
            question: "💡 I can help with that! [specific guidance] or connecting you with the right expert."

            Generate response for: %s
            """;

    private final LlmService llmService;
    private final FallbackResponseWriter fallbackWriter;
    private final AgentProperties agentProperties;
    private final double temperature;

    public ResponseComposer(LlmService llmService, FallbackResponseWriter fallbackWriter,
                            AgentProperties agentProperties, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.fallbackWriter = fallbackWriter;
        this.agentProperties = agentProperties;
        this.temperature = llmProperties.responseTemperature();
    }

    /**
     * @param skipModel true when the model already failed earlier in this run
     */
    public String compose(String message, ClassificationResult classification, EntitySet entities, boolean skipModel) {
        String reply;
        if (skipModel || !llmService.isAvailable()) {
            reply = fallbackWriter.write(message, classification.intent(), entities);
        } else {
            ModelResult<String> attempt = modelReply(message, classification, entities);
            if (attempt instanceof ModelResult.Ok<String> ok) {
                reply = ok.value();
            } else {
                reply = fallbackWriter.write(message, classification.intent(), entities);
            }
        }
        if (classification.confidence() < agentProperties.escalationThreshold()) {
            reply = reply + "\n\n" + agentProperties.lowConfidenceNotice();
        }
        return reply;
    }

    private ModelResult<String> modelReply(String message, ClassificationResult classification, EntitySet entities) {
        String prompt = PROMPT_TEMPLATE.formatted(
                message,
                classification.intent().label(),
                String.format(Locale.ROOT, "%.2f", classification.confidence()),
                describe(entities),
                classification.intent().label());
        try {
            String reply = llmService.complete(prompt, temperature);
            if (reply.isBlank()) {
                return ModelResult.err(ModelError.EMPTY_RESPONSE, "blank reply");
            }
            return ModelResult.ok(reply);
        } catch (RuntimeException e) {
            ModelError error = ModelError.from(e);
            log.warn("Model response generation failed ({}), using fallback reply: {}", error, e.getMessage());
            return ModelResult.err(error, e.getMessage());
        }
    }

    /**
     * Compact one-line summary of the extracted entities for the prompt.
     */
    static String describe(EntitySet entities) {
        List<String> parts = new ArrayList<>();
        if (entities.contains(EntityCategory.URGENCY)) {
            parts.add("Urgency detected: " + entities.get(EntityCategory.URGENCY));
        }
        if (entities.contains(EntityCategory.EQUIPMENT)) {
            parts.add("Equipment mentioned: " + entities.get(EntityCategory.EQUIPMENT));
        }
        if (entities.contains(EntityCategory.LOCATIONS)) {
            parts.add("Location: " + entities.get(EntityCategory.LOCATIONS));
        }
        if (entities.contains(EntityCategory.TIME_MENTIONS)) {
            parts.add("Time mentioned: " + entities.get(EntityCategory.TIME_MENTIONS));
        }
        return parts.isEmpty() ? "Standard message" : String.join(" | ", parts);
    }
}
