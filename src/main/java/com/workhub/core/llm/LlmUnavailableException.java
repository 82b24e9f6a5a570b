package com.workhub.core.llm;

/**
 * Thrown when a completion is requested although no model endpoint is configured.
 */
public class LlmUnavailableException extends RuntimeException {

    public LlmUnavailableException(String message) {
        super(message);
    }
}
