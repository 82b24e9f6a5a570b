package com.workhub.core.nodes;

import com.workhub.core.model.ClassificationResult;
import com.workhub.core.response.ResponseComposer;
import com.workhub.core.state.WorkerMessageState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ComposeResponseNode {

    private final ResponseComposer composer;

    public ComposeResponseNode(ResponseComposer composer) {
        this.composer = composer;
    }

    public Map<String, Object> apply(WorkerMessageState state) {
        ClassificationResult classification = state.classification()
                .orElseThrow(() -> new IllegalStateException(
                        "compose_response reached without a classification for " + state.messageId()));
        String reply = composer.compose(state.text(), classification, state.entities(), state.modelUnavailable());
        return Map.of("responseText", reply);
    }
}
