package com.workhub.dispatch.cli;

import com.workhub.actions.ActionExecutionResult;
import com.workhub.core.health.HealthCheckService;
import com.workhub.core.health.HealthStatus;
import com.workhub.core.model.*;
import com.workhub.intake.MessageIntakeService;
import com.workhub.intake.ProcessedMessage;
import com.workhub.intake.WorkerMessageRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static ProcessedMessage incidentOutcome(boolean actionSucceeded) {
        var outcome = new AgentOutcome(
                new WorkerMessage("MSG-2026-000001", "Gas leak in the basement, urgent", "cli", Instant.now()),
                new ClassificationResult(Intent.INCIDENT_REPORT, 0.52),
                ClassificationSource.RULES,
                EntitySet.of(Map.of(EntityCategory.LOCATIONS, List.of("basement"))),
                new RoutingDecision(DatabaseAction.CREATE_INCIDENT_RECORD, true, false),
                "Incident reported! Safety team has been alerted.");
        ActionExecutionResult action = actionSucceeded
                ? ActionExecutionResult.ok(DatabaseAction.CREATE_INCIDENT_RECORD, "incident (critical)")
                : ActionExecutionResult.failed(DatabaseAction.CREATE_INCIDENT_RECORD, "sender id is not a numeric user id");
        return new ProcessedMessage(outcome, action);
    }

    private static HealthCheckService healthService(HealthStatus... statuses) {
        HealthCheckService service = mock(HealthCheckService.class);
        when(service.checkAll()).thenReturn(List.of(statuses));
        return service;
    }

    private CommandLine.IFactory createFactory(MessageIntakeService intake, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ProcessCommand.class) {
                    return (K) new ProcessCommand(intake);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(MessageIntakeService intake, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new WorkhubCommand(),
                    createFactory(intake != null ? intake : mock(MessageIntakeService.class), health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(null, null, args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("process", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WorkHub Agent 0.1.0"));
        }

        @Test
        @DisplayName("process --help shows the sender option")
        void processHelp() {
            CliResult result = execute("process", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--sender"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArgs() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WORKHUB AGENT"));
            assertTrue(result.output().contains("Usage"));
        }
    }

    @Nested
    @DisplayName("process")
    class ProcessTests {

        @Test
        @DisplayName("prints intent, entities and reply")
        void printsOutcome() {
            MessageIntakeService intake = mock(MessageIntakeService.class);
            when(intake.handle(any())).thenReturn(incidentOutcome(true));

            CliResult result = execute(intake, null, "process", "Gas leak in the basement, urgent", "-s", "42");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("incident_report"));
            assertTrue(result.output().contains("locations: basement"));
            assertTrue(result.output().contains("MANAGER ALERTED"));
            assertTrue(result.output().contains("Incident reported! Safety team has been alerted."));

            ArgumentCaptor<WorkerMessageRequest> captor = ArgumentCaptor.forClass(WorkerMessageRequest.class);
            verify(intake).handle(captor.capture());
            assertEquals("42", captor.getValue().senderId());
        }

        @Test
        @DisplayName("failed action is reported but still exits 0")
        void failedActionWarns() {
            MessageIntakeService intake = mock(MessageIntakeService.class);
            when(intake.handle(any())).thenReturn(incidentOutcome(false));

            CliResult result = execute(intake, null, "process", "Gas leak in the basement, urgent");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Action not applied"));
        }

        @Test
        @DisplayName("blank message exits 2")
        void blankMessage() {
            CliResult result = execute("process", "  ");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Message text is required"));
        }

        @Test
        @DisplayName("processing error exits 1")
        void processingError() {
            MessageIntakeService intake = mock(MessageIntakeService.class);
            when(intake.handle(any())).thenThrow(new IllegalStateException("graph returned no state"));

            CliResult result = execute(intake, null, "process", "hello");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("graph returned no state"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("degraded components exit 0")
        void degraded() {
            CliResult result = execute(null, healthService(
                    new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled and available", Map.of()),
                    new HealthStatus("database", HealthStatus.Status.DEGRADED, "No DataSource configured", Map.of())),
                    "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("degraded mode"));
        }

        @Test
        @DisplayName("a DOWN component exits 1")
        void down() {
            CliResult result = execute(null, healthService(
                    new HealthStatus("graph", HealthStatus.Status.DOWN, "Graph not available", Map.of())),
                    "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Graph not available"));
        }

        @Test
        @DisplayName("missing health service exits 1")
        void missingService() {
            CliResult result = execute((MessageIntakeService) null, null, "health");
            assertEquals(1, result.exitCode());
        }
    }
}
