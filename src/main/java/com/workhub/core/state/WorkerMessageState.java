package com.workhub.core.state;

import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.ClassificationSource;
import com.workhub.core.model.EntitySet;
import com.workhub.core.model.RoutingDecision;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state for a single worker message as it moves through the pipeline.
 * <p>
 * Each stage writes its own channel; later stages read earlier ones. Errors use an
 * appender channel so every node can record a problem without dropping others.
 */
public class WorkerMessageState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("messageId",            Channels.base(() -> "")),
        Map.entry("senderId",             Channels.base(() -> "")),
        Map.entry("text",                 Channels.base(() -> "")),
        Map.entry("receivedAt",           Channels.base((Reducer<Instant>) null)),
        Map.entry("entities",             Channels.base((Reducer<EntitySet>) null)),
        Map.entry("classification",       Channels.base((Reducer<ClassificationResult>) null)),
        Map.entry("classificationSource", Channels.base(() -> ClassificationSource.RULES.name())),
        Map.entry("modelUnavailable",     Channels.base(() -> false)),
        Map.entry("routing",              Channels.base((Reducer<RoutingDecision>) null)),
        Map.entry("responseText",         Channels.base(() -> "")),
        Map.entry("errors",               Channels.appender(ArrayList::new))
    );

    public WorkerMessageState(Map<String, Object> initData) {
        super(initData);
    }

    public String messageId() {
        return this.<String>value("messageId").orElse("");
    }

    public String senderId() {
        return this.<String>value("senderId").orElse("");
    }

    public String text() {
        return this.<String>value("text").orElse("");
    }

    public Instant receivedAt() {
        return this.<Instant>value("receivedAt").orElseGet(Instant::now);
    }

    public EntitySet entities() {
        return this.<EntitySet>value("entities").orElse(EntitySet.empty());
    }

    public Optional<ClassificationResult> classification() {
        return value("classification");
    }

    public ClassificationSource classificationSource() {
        String raw = this.<String>value("classificationSource").orElse(ClassificationSource.RULES.name());
        return ClassificationSource.valueOf(raw);
    }

    public boolean modelUnavailable() {
        return this.<Boolean>value("modelUnavailable").orElse(false);
    }

    public Optional<RoutingDecision> routing() {
        return value("routing");
    }

    public String responseText() {
        return this.<String>value("responseText").orElse("");
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
