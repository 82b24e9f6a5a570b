package com.workhub.core.engine;

import com.workhub.core.graph.AgentGraph;
import com.workhub.core.logging.MdcContext;
import com.workhub.core.metrics.AgentMetrics;
import com.workhub.core.model.AgentOutcome;
import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.RoutingDecision;
import com.workhub.core.model.WorkerMessage;
import com.workhub.core.state.WorkerMessageState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one worker message through the compiled graph and turns the final state
 * into an {@link AgentOutcome}.
 * <p>
 * Model failures never surface here; they are absorbed inside the graph.
 */
@Service
public class AgentEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentEngine.class);
    private static final AtomicInteger MESSAGE_COUNTER = new AtomicInteger(0);
    private static final int PREVIEW_LENGTH = 60;

    private final AgentGraph agentGraph;
    private final AgentMetrics metrics;

    public AgentEngine(AgentGraph agentGraph, AgentMetrics metrics) {
        this.agentGraph = agentGraph;
        this.metrics = metrics;
    }

    public AgentOutcome process(String text, String senderId) {
        return process(generateMessageId(), text, senderId);
    }

    /**
     * @throws IllegalStateException if the graph produced no final state or skipped a stage
     */
    public AgentOutcome process(String messageId, String text, String senderId) {
        String body = text == null ? "" : text;
        String sender = senderId == null ? "" : senderId;
        Instant receivedAt = Instant.now();

        MdcContext.setMessage(messageId, sender);
        try {
            if (log.isDebugEnabled()) {
                log.debug("Processing message {}: {}", messageId, preview(body));
            }

            Map<String, Object> initialState = Map.of(
                    "messageId", messageId,
                    "senderId", sender,
                    "text", body,
                    "receivedAt", receivedAt);

            long start = System.currentTimeMillis();
            var result = agentGraph.getCompiledGraph().invoke(initialState);
            WorkerMessageState state = result.orElseThrow(() ->
                    new IllegalStateException("Graph execution returned empty state for message " + messageId));
            metrics.recordPipelineDuration(System.currentTimeMillis() - start);

            AgentOutcome outcome = toOutcome(new WorkerMessage(messageId, body, sender, receivedAt), state);
            metrics.recordMessageProcessed(outcome.intent().label(),
                    outcome.classificationSource().name().toLowerCase(Locale.ROOT));
            if (outcome.requiresManagerAttention()) {
                metrics.recordEscalation(outcome.intent().label());
            }
            log.info("Message {} classified as {} ({}) via {}, action={}, escalate={}",
                    messageId, outcome.intent().label(), String.format("%.2f", outcome.confidence()),
                    outcome.classificationSource(), outcome.action().label(), outcome.requiresManagerAttention());
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private static AgentOutcome toOutcome(WorkerMessage message, WorkerMessageState state) {
        ClassificationResult classification = state.classification().orElseThrow(() ->
                new IllegalStateException("Final state has no classification for " + message.messageId()));
        RoutingDecision routing = state.routing().orElseThrow(() ->
                new IllegalStateException("Final state has no routing decision for " + message.messageId()));
        String reply = state.responseText();
        if (reply.isBlank()) {
            throw new IllegalStateException("Final state has no response text for " + message.messageId());
        }
        return new AgentOutcome(message, classification, state.classificationSource(),
                state.entities(), routing, reply);
    }

    /**
     * Generates a message ID in the format MSG-YYYY-NNNNNN.
     */
    public String generateMessageId() {
        int count = MESSAGE_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("MSG-%d-%06d", year, count);
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
