package com.workhub.intake;

import com.workhub.actions.ActionExecutionResult;
import com.workhub.actions.ActionExecutor;
import com.workhub.core.engine.AgentEngine;
import com.workhub.core.events.EventBus;
import com.workhub.core.events.WorkhubEvent;
import com.workhub.core.metrics.AgentMetrics;
import com.workhub.core.model.AgentOutcome;
import com.workhub.notify.ManagerNotification;
import com.workhub.notify.ManagerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Handles one inbound worker message end to end: understand it, act on it,
 * alert managers if needed and publish the reply.
 * <p>
 * A failing action or manager alert never blocks the reply.
 */
@Service
public class MessageIntakeService {

    public static final String RESPONSE_EVENT = "agent.response";

    /** Canonical messages used by the self-test endpoint. */
    public static final List<WorkerMessageRequest> SELF_TEST_MESSAGES = List.of(
            new WorkerMessageRequest("Just finished the plumbing repair in Building A", "1", "1"),
            new WorkerMessageRequest("There's a gas leak in the basement - urgent!", "2", "2"),
            new WorkerMessageRequest("Can I get approval for overtime this weekend?", "3", "3"));

    private static final Logger log = LoggerFactory.getLogger(MessageIntakeService.class);

    private final AgentEngine agentEngine;
    private final ActionExecutor actionExecutor;
    private final ManagerNotifier managerNotifier;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public MessageIntakeService(AgentEngine agentEngine, ActionExecutor actionExecutor,
                                ManagerNotifier managerNotifier, EventBus eventBus, AgentMetrics metrics) {
        this.agentEngine = agentEngine;
        this.actionExecutor = actionExecutor;
        this.managerNotifier = managerNotifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException if the message text or sender id is blank
     */
    public ProcessedMessage handle(WorkerMessageRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (request.senderId() == null || request.senderId().isBlank()) {
            throw new IllegalArgumentException("sender_id must not be blank");
        }

        AgentOutcome outcome = agentEngine.process(request.message(), request.senderId());

        ActionExecutionResult actionResult = execute(outcome);
        metrics.recordActionResult(outcome.action().label(), actionResult.success());

        if (outcome.requiresManagerAttention()) {
            notifyManagers(outcome);
        }

        if (request.chatId() != null && !request.chatId().isBlank()) {
            publishReply(request.chatId(), outcome);
        }
        return new ProcessedMessage(outcome, actionResult);
    }

    public List<ProcessedMessage> selfTest() {
        return SELF_TEST_MESSAGES.stream().map(this::handle).toList();
    }

    private ActionExecutionResult execute(AgentOutcome outcome) {
        try {
            return actionExecutor.execute(outcome.action(), outcome.message().senderId(),
                    outcome.message().text(), outcome.entities());
        } catch (RuntimeException e) {
            log.warn("Action {} threw for message {}: {}", outcome.action().label(),
                    outcome.message().messageId(), e.getMessage(), e);
            return ActionExecutionResult.failed(outcome.action(), e.getMessage());
        }
    }

    private void notifyManagers(AgentOutcome outcome) {
        try {
            managerNotifier.notify(ManagerNotification.from(outcome));
        } catch (RuntimeException e) {
            log.warn("Manager alert failed for message {}: {}", outcome.message().messageId(), e.getMessage(), e);
        }
    }

    private void publishReply(String chatId, AgentOutcome outcome) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("response", outcome.responseText());
        payload.put("intent", outcome.intent().label());
        payload.put("confidence", outcome.confidence());
        int listeners = eventBus.publish(new WorkhubEvent(RESPONSE_EVENT, "chat-" + chatId,
                outcome.message().messageId(), payload, Instant.now()));
        log.debug("Reply for message {} delivered to {} listener(s) on chat-{}",
                outcome.message().messageId(), listeners, chatId);
    }
}
