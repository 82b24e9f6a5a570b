package com.workhub.core.nodes;

import com.workhub.core.classify.HybridClassification;
import com.workhub.core.classify.HybridIntentClassifier;
import com.workhub.core.state.WorkerMessageState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns an intent to the message and records which classifier produced it.
 * <p>
 * When the model endpoint itself failed, {@code modelUnavailable} is set so the
 * response stage does not try it again in the same run.
 */
@Component
public class ClassifyIntentNode {

    private final HybridIntentClassifier classifier;

    public ClassifyIntentNode(HybridIntentClassifier classifier) {
        this.classifier = classifier;
    }

    public Map<String, Object> apply(WorkerMessageState state) {
        HybridClassification result = classifier.classify(state.text());

        var updates = new HashMap<String, Object>();
        updates.put("classification", result.result());
        updates.put("classificationSource", result.source().name());
        updates.put("modelUnavailable", result.modelUnavailable());
        if (result.modelUnavailable()) {
            updates.put("errors", List.of("classification model unavailable: " + result.modelError().tag()));
        }
        return updates;
    }
}
