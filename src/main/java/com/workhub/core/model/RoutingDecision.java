package com.workhub.core.model;

import java.io.Serializable;

/**
 * Outcome of routing a classified message.
 *
 * @param action                   persistence operation to run
 * @param requiresManagerAttention whether a supervisor must be notified
 * @param autoProcess              confidence was high enough to process without review
 */
public record RoutingDecision(
        DatabaseAction action,
        boolean requiresManagerAttention,
        boolean autoProcess
) implements Serializable {}
