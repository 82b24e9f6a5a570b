package com.workhub.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A single inbound message from a field worker. Consumed once by the pipeline, never mutated.
 */
public record WorkerMessage(
        String messageId,
        String text,
        String senderId,
        Instant receivedAt
) implements Serializable {}
