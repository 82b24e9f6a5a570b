package com.workhub.core.nodes;

import com.workhub.core.extraction.EntityExtractor;
import com.workhub.core.state.WorkerMessageState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ExtractEntitiesNode {

    private final EntityExtractor extractor;

    public ExtractEntitiesNode(EntityExtractor extractor) {
        this.extractor = extractor;
    }

    public Map<String, Object> apply(WorkerMessageState state) {
        return Map.of("entities", extractor.extract(state.text()));
    }
}
