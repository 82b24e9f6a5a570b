package com.workhub.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.workhub.core.model.AgentOutcome;
import com.workhub.core.model.EntitySet;
import com.workhub.intake.ProcessedMessage;

import java.util.Locale;

/**
 * JSON response for a processed worker message.
 */
public record MessageResponse(
    @JsonProperty("message_id") String messageId,
    String intent,
    double confidence,
    String response,
    @JsonProperty("database_action") String databaseAction,
    @JsonProperty("requires_manager_attention") boolean requiresManagerAttention,
    @JsonProperty("auto_process") boolean autoProcess,
    EntitySet entities,
    @JsonProperty("classification_source") String classificationSource,
    @JsonProperty("action_succeeded") boolean actionSucceeded
) {

    public static MessageResponse from(ProcessedMessage processed) {
        AgentOutcome outcome = processed.outcome();
        return new MessageResponse(
                outcome.message().messageId(),
                outcome.intent().label(),
                outcome.confidence(),
                outcome.responseText(),
                outcome.action().label(),
                outcome.requiresManagerAttention(),
                outcome.routing().autoProcess(),
                outcome.entities(),
                outcome.classificationSource().name().toLowerCase(Locale.ROOT),
                processed.actionResult().success());
    }
}
