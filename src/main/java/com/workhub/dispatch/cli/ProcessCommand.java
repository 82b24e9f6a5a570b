package com.workhub.dispatch.cli;

import com.workhub.intake.MessageIntakeService;
import com.workhub.intake.ProcessedMessage;
import com.workhub.intake.WorkerMessageRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: workhub process "&lt;message&gt;"
 * <p>
 * Runs one message through the full intake path (classification, action,
 * manager alert) and prints the outcome and the reply.
 */
@Command(name = "process", mixinStandardHelpOptions = true, description = "Process a single worker message")
@Component
public class ProcessCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Message text as the worker typed it")
    private String message;

    @Option(names = {"--sender", "-s"}, description = "Sender (worker) id", defaultValue = "cli")
    private String senderId;

    private final MessageIntakeService intakeService;

    public ProcessCommand(MessageIntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (message == null || message.isBlank()) {
            ConsoleOutput.error("Message text is required");
            return 2;
        }

        ProcessedMessage processed;
        try {
            processed = intakeService.handle(new WorkerMessageRequest(message, senderId, null));
        } catch (Exception e) {
            ConsoleOutput.error("Processing failed: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.outcome(processed.outcome(), processed.actionResult().success());
        if (!processed.actionResult().success()) {
            ConsoleOutput.warn("Action not applied: " + processed.actionResult().detail());
        }
        return 0;
    }
}
