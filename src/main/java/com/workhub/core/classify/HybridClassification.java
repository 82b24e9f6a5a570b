package com.workhub.core.classify;

import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.ClassificationSource;

import java.io.Serializable;

/**
 * Result of the hybrid classifier plus how it was obtained.
 *
 * @param result     the accepted classification
 * @param source     which path produced it
 * @param modelError why the model gave no usable reply; {@code null} when it replied validly,
 *                   even if that reply was then rejected for low confidence
 */
public record HybridClassification(
        ClassificationResult result,
        ClassificationSource source,
        ModelError modelError
) implements Serializable {

    /** Whether the model endpoint failed in a way that makes another call pointless. */
    public boolean modelUnavailable() {
        return modelError != null && modelError.endpointUnavailable();
    }
}
