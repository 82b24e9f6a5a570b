package com.workhub.core.model;

import java.io.Serializable;

/**
 * Final artifact of one pipeline run, handed unchanged to the intake layer.
 */
public record AgentOutcome(
        WorkerMessage message,
        ClassificationResult classification,
        ClassificationSource classificationSource,
        EntitySet entities,
        RoutingDecision routing,
        String responseText
) implements Serializable {

    public Intent intent() {
        return classification.intent();
    }

    public double confidence() {
        return classification.confidence();
    }

    public DatabaseAction action() {
        return routing.action();
    }

    public boolean requiresManagerAttention() {
        return routing.requiresManagerAttention();
    }
}
