package com.workhub.core.classify;

import com.workhub.core.llm.LlmEmptyResponseException;
import com.workhub.core.llm.LlmUnavailableException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Why a model-assisted stage produced no usable result.
 */
public enum ModelError {
    NOT_CONFIGURED,
    TIMEOUT,
    CALL_FAILED,
    EMPTY_RESPONSE,
    MALFORMED_RESPONSE,
    UNKNOWN_LABEL;

    /**
     * True when the endpoint itself is unreachable or slow, so a second call
     * in the same run would most likely fail the same way.
     */
    public boolean endpointUnavailable() {
        return this == TIMEOUT || this == CALL_FAILED;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps an exception thrown by the model client to an error kind.
     */
    public static ModelError from(Throwable failure) {
        if (failure instanceof LlmUnavailableException) {
            return NOT_CONFIGURED;
        }
        if (failure instanceof LlmEmptyResponseException) {
            return EMPTY_RESPONSE;
        }
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return TIMEOUT;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return CALL_FAILED;
    }
}
