package com.workhub.dispatch.api;

import com.workhub.core.metrics.AgentMetrics;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller exposing processing totals since startup.
 */
@RestController
@RequestMapping("/api/v1/stats")
public class StatsController {

    private final AgentMetrics metrics;

    public StatsController(AgentMetrics metrics) {
        this.metrics = metrics;
    }

    @GetMapping
    public Map<String, Object> stats() {
        var snapshot = metrics.snapshot();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_messages_processed", snapshot.totalProcessed());
        result.put("by_intent", snapshot.processedByIntent());
        result.put("escalations", snapshot.escalationsByIntent());
        result.put("database_actions", snapshot.actionsByResult());
        result.put("model_fallbacks", snapshot.modelFallbacksByReason());
        return result;
    }
}
