package com.workhub.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Streams manager alerts ({@code managers}) and chat replies ({@code chat-<chatId>}) over SSE.
 */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final SseStreamingService sseStreamingService;

    public NotificationController(SseStreamingService sseStreamingService) {
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping(value = "/{channel}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String channel) {
        return sseStreamingService.createEmitter(channel);
    }
}
