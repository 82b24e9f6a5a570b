package com.workhub.core.nodes;

import com.workhub.core.model.ClassificationResult;
import com.workhub.core.routing.ActionRouter;
import com.workhub.core.state.WorkerMessageState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RouteActionNode {

    private final ActionRouter router;

    public RouteActionNode(ActionRouter router) {
        this.router = router;
    }

    public Map<String, Object> apply(WorkerMessageState state) {
        ClassificationResult classification = state.classification()
                .orElseThrow(() -> new IllegalStateException(
                        "route_action reached without a classification for " + state.messageId()));
        return Map.of("routing", router.route(classification, state.entities()));
    }
}
