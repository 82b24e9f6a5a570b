package com.workhub.dispatch.api;

import com.workhub.intake.MessageIntakeService;
import com.workhub.intake.ProcessedMessage;
import com.workhub.intake.WorkerMessageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for submitting worker messages.
 */
@RestController
@RequestMapping("/api/v1/messages")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final MessageIntakeService intakeService;

    public MessageController(MessageIntakeService intakeService) {
        this.intakeService = intakeService;
    }

    /**
     * POST /api/v1/messages: classify, act on and reply to one message. Runs synchronously.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody WorkerMessageRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message text is required"));
        }
        if (request.senderId() == null || request.senderId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "sender_id is required"));
        }

        ProcessedMessage processed = intakeService.handle(request);
        return ResponseEntity.ok(MessageResponse.from(processed));
    }

    /**
     * POST /api/v1/messages/self-test: runs the canonical sample messages.
     */
    @PostMapping("/self-test")
    public ResponseEntity<Map<String, Object>> selfTest() {
        log.info("Running self-test messages");
        List<Map<String, Object>> results = intakeService.selfTest().stream()
                .map(processed -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("input", processed.outcome().message().text());
                    entry.put("intent", processed.outcome().intent().label());
                    entry.put("confidence", processed.outcome().confidence());
                    entry.put("response", processed.outcome().responseText());
                    return entry;
                })
                .toList();
        return ResponseEntity.ok(Map.of("test_results", results));
    }
}
