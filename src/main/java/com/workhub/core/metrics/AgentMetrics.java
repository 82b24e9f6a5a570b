package com.workhub.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Centralised Micrometer metrics for the message pipeline.
 */
@Service
public class AgentMetrics {

    static final String MESSAGES_PROCESSED = "workhub.messages.processed";
    static final String MODEL_FALLBACKS = "workhub.classifier.model_fallbacks";
    static final String ESCALATIONS = "workhub.escalations.total";
    static final String ACTIONS_EXECUTED = "workhub.actions.executed";
    static final String PIPELINE_DURATION = "workhub.pipeline.duration";

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMessageProcessed(String intent, String source) {
        Counter.builder(MESSAGES_PROCESSED)
                .tag("intent", intent)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the model result was not used, e.g. {@code timeout} or {@code low_confidence}
     */
    public void recordModelFallback(String reason) {
        Counter.builder(MODEL_FALLBACKS)
                .description("Classifications that fell back to the rule-based classifier")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String intent) {
        Counter.builder(ESCALATIONS)
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    public void recordActionResult(String action, boolean success) {
        Counter.builder(ACTIONS_EXECUTED)
                .tag("action", action)
                .tag("result", success ? "ok" : "failed")
                .register(registry)
                .increment();
    }

    public void recordPipelineDuration(long ms) {
        Timer.builder(PIPELINE_DURATION)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Reads the current counter values back out of the registry.
     */
    public StatsSnapshot snapshot() {
        return new StatsSnapshot(
                sumByTag(MESSAGES_PROCESSED, "intent"),
                sumByTag(ESCALATIONS, "intent"),
                sumByTag(ACTIONS_EXECUTED, "result"),
                sumByTag(MODEL_FALLBACKS, "reason"));
    }

    private Map<String, Long> sumByTag(String meterName, String tagKey) {
        var totals = new TreeMap<String, Long>();
        for (Counter counter : registry.find(meterName).counters()) {
            String tagValue = counter.getId().getTag(tagKey);
            if (tagValue != null) {
                totals.merge(tagValue, (long) counter.count(), Long::sum);
            }
        }
        return totals;
    }

    /**
     * Point-in-time totals, each keyed by the relevant tag value.
     */
    public record StatsSnapshot(
            Map<String, Long> processedByIntent,
            Map<String, Long> escalationsByIntent,
            Map<String, Long> actionsByResult,
            Map<String, Long> modelFallbacksByReason
    ) {
        public long totalProcessed() {
            return processedByIntent.values().stream().mapToLong(Long::longValue).sum();
        }
    }
}
