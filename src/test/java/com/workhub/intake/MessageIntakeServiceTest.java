package com.workhub.intake;

import com.workhub.actions.ActionDetailsResolver;
import com.workhub.actions.ActionExecutor;
import com.workhub.actions.LoggingActionExecutor;
import com.workhub.core.PipelineFixtures;
import com.workhub.core.engine.AgentEngine;
import com.workhub.core.events.EventBus;
import com.workhub.core.events.WorkhubEvent;
import com.workhub.core.llm.LlmService;
import com.workhub.core.metrics.AgentMetrics;
import com.workhub.core.model.*;
import com.workhub.notify.EventBusManagerNotifier;
import com.workhub.notify.ManagerNotifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MessageIntakeServiceTest {

    private EventBus eventBus;
    private AgentMetrics metrics;
    private List<WorkhubEvent> managerAlerts;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        metrics = new AgentMetrics(new SimpleMeterRegistry());
        managerAlerts = new CopyOnWriteArrayList<>();
        eventBus.subscribe(EventBusManagerNotifier.MANAGERS_CHANNEL, managerAlerts::add);
    }

    private static AgentOutcome outcome(Intent intent, double confidence, DatabaseAction action, boolean attention) {
        return new AgentOutcome(
                new WorkerMessage("MSG-1", "Broken ladder on site 3", "17", Instant.now()),
                new ClassificationResult(intent, confidence),
                ClassificationSource.RULES,
                EntitySet.empty(),
                new RoutingDecision(action, attention, confidence > 0.6),
                "Thanks for the report.");
    }

    private MessageIntakeService service(AgentEngine engine, ActionExecutor executor) {
        return new MessageIntakeService(engine, executor, new EventBusManagerNotifier(eventBus), eventBus, metrics);
    }

    @Nested
    @DisplayName("with a stubbed engine")
    class Stubbed {

        private AgentEngine engine;

        @BeforeEach
        void stubEngine() {
            engine = mock(AgentEngine.class);
        }

        @Test
        @DisplayName("failing action still produces a reply")
        void failingActionStillReplies() {
            when(engine.process(anyString(), anyString()))
                    .thenReturn(outcome(Intent.TASK_UPDATE, 0.8, DatabaseAction.UPDATE_TASK_PROGRESS, false));
            ActionExecutor executor = mock(ActionExecutor.class);
            when(executor.execute(any(), anyString(), anyString(), any()))
                    .thenThrow(new IllegalStateException("pool exhausted"));

            ProcessedMessage result = service(engine, executor)
                    .handle(new WorkerMessageRequest("Broken ladder on site 3", "17", null));

            assertEquals("Thanks for the report.", result.outcome().responseText());
            assertFalse(result.actionResult().success());
            assertEquals("pool exhausted", result.actionResult().detail());
            assertEquals(1L, metrics.snapshot().actionsByResult().get("failed"));
        }

        @Test
        @DisplayName("escalated outcome sends exactly one manager alert")
        void escalationAlertsOnce() {
            when(engine.process(anyString(), anyString()))
                    .thenReturn(outcome(Intent.INCIDENT_REPORT, 0.7, DatabaseAction.CREATE_INCIDENT_RECORD, true));

            service(engine, new LoggingActionExecutor(new ActionDetailsResolver()))
                    .handle(new WorkerMessageRequest("Broken ladder on site 3", "17", null));

            assertEquals(1, managerAlerts.size());
            WorkhubEvent alert = managerAlerts.get(0);
            assertEquals(EventBusManagerNotifier.ALERT_EVENT, alert.eventType());
            assertEquals("incident_report", alert.payload().get("intent"));
            assertEquals("17", alert.payload().get("sender_id"));
            assertEquals("create_incident_record", alert.payload().get("action"));
        }

        @Test
        @DisplayName("routine outcome sends no alert")
        void noAlertForRoutine() {
            when(engine.process(anyString(), anyString()))
                    .thenReturn(outcome(Intent.TASK_UPDATE, 0.8, DatabaseAction.UPDATE_TASK_PROGRESS, false));

            service(engine, new LoggingActionExecutor(new ActionDetailsResolver()))
                    .handle(new WorkerMessageRequest("Broken ladder on site 3", "17", null));

            assertTrue(managerAlerts.isEmpty());
        }

        @Test
        @DisplayName("reply is published on the chat channel")
        void publishesChatReply() {
            when(engine.process(anyString(), anyString()))
                    .thenReturn(outcome(Intent.TASK_UPDATE, 0.8, DatabaseAction.UPDATE_TASK_PROGRESS, false));
            List<WorkhubEvent> chat = new CopyOnWriteArrayList<>();
            eventBus.subscribe("chat-55", chat::add);

            service(engine, new LoggingActionExecutor(new ActionDetailsResolver()))
                    .handle(new WorkerMessageRequest("Broken ladder on site 3", "17", "55"));

            assertEquals(1, chat.size());
            assertEquals(MessageIntakeService.RESPONSE_EVENT, chat.get(0).eventType());
            assertEquals("Thanks for the report.", chat.get(0).payload().get("response"));
        }

        @Test
        @DisplayName("failing manager alert still produces and publishes the reply")
        void failingAlertStillReplies() {
            when(engine.process(anyString(), anyString()))
                    .thenReturn(outcome(Intent.INCIDENT_REPORT, 0.7, DatabaseAction.CREATE_INCIDENT_RECORD, true));
            ManagerNotifier notifier = mock(ManagerNotifier.class);
            doThrow(new IllegalStateException("dashboard gone")).when(notifier).notify(any());
            List<WorkhubEvent> chat = new CopyOnWriteArrayList<>();
            eventBus.subscribe("chat-56", chat::add);

            var service = new MessageIntakeService(engine, new LoggingActionExecutor(new ActionDetailsResolver()),
                    notifier, eventBus, metrics);
            ProcessedMessage result = service.handle(new WorkerMessageRequest("Broken ladder on site 3", "17", "56"));

            assertEquals("Thanks for the report.", result.outcome().responseText());
            assertTrue(result.actionResult().success());
            verify(notifier).notify(any());
            assertEquals(1, chat.size());
        }

        @Test
        @DisplayName("blank message or sender is rejected before processing")
        void rejectsBlankInput() {
            var service = service(engine, mock(ActionExecutor.class));

            assertThrows(IllegalArgumentException.class,
                    () -> service.handle(new WorkerMessageRequest("  ", "17", null)));
            assertThrows(IllegalArgumentException.class,
                    () -> service.handle(new WorkerMessageRequest("hello", null, null)));
            verifyNoInteractions(engine);
        }
    }

    @Test
    @DisplayName("self-test runs the canonical messages through the real pipeline")
    void selfTest() throws Exception {
        LlmService llm = mock(LlmService.class);
        when(llm.isAvailable()).thenReturn(false);
        var engine = new AgentEngine(PipelineFixtures.graph(llm, metrics), metrics);

        List<ProcessedMessage> results = service(engine, new LoggingActionExecutor(new ActionDetailsResolver()))
                .selfTest();

        assertEquals(List.of(Intent.TASK_UPDATE, Intent.INCIDENT_REPORT, Intent.PERMISSION_REQUEST),
                results.stream().map(r -> r.outcome().intent()).toList());
        assertTrue(results.stream().allMatch(r -> r.actionResult().success()));
        // incident and permission always escalate
        assertEquals(2, managerAlerts.size());
        assertEquals(3L, metrics.snapshot().totalProcessed());
    }
}
