package com.workhub.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Intent assigned to a message together with the classifier's certainty.
 *
 * @param intent     one of the six known intents
 * @param confidence certainty in {@code [0, 1]}
 */
public record ClassificationResult(Intent intent, double confidence) implements Serializable {

    public ClassificationResult {
        Objects.requireNonNull(intent, "intent");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1] but was " + confidence);
        }
    }

    /** Result used when nothing in the message matches any known pattern. */
    public static ClassificationResult unmatched() {
        return new ClassificationResult(Intent.GENERAL, 0.5);
    }
}
