package com.workhub.dispatch.api;

import com.workhub.core.events.EventBus;
import com.workhub.core.events.WorkhubEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    private static WorkhubEvent alert(String channel) {
        return new WorkhubEvent("manager.alert", channel, "MSG-2026-000003",
                Map.of("intent", "incident_report"), Instant.parse("2026-03-01T08:15:00Z"));
    }

    /** Service whose emitters are Mockito mocks, so writes can be observed or made to fail. */
    private static SseStreamingService withEmitter(EventBus bus, SseEmitter emitter) {
        return new SseStreamingService(bus, 1_000L) {
            @Override
            SseEmitter openEmitter(long timeout) {
                return emitter;
            }
        };
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitter {

        @Test
        @DisplayName("each client gets its own stream and bus listener")
        void separateStreams() {
            SseEmitter first = service.createEmitter("managers");
            SseEmitter second = service.createEmitter("managers");

            assertNotSame(first, second);
            assertEquals(2, service.openStreamCount());
            assertEquals(2, eventBus.listenerCount("managers"));
            assertEquals(0, eventBus.listenerCount("chat-1"));
        }

        @Test
        @DisplayName("uses the configured timeout")
        void timeout() {
            SseEmitter emitter = new SseStreamingService(eventBus, 250L).createEmitter("managers");
            assertEquals(250L, emitter.getTimeout());
        }
    }

    @Test
    @DisplayName("events on the channel are written to the client")
    void forwardsChannelEvents() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        withEmitter(eventBus, emitter).createEmitter("managers");

        assertEquals(1, eventBus.publish(alert("managers")));
        eventBus.publish(alert("chat-1"));

        // connected comment + one event
        verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    @DisplayName("a failed write closes the stream and drops its listener")
    void failedWriteCloses() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        SseStreamingService failing = withEmitter(eventBus, emitter);
        failing.createEmitter("chat-9");
        doThrow(new IOException("broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));

        eventBus.publish(alert("chat-9"));

        assertEquals(0, failing.openStreamCount());
        assertEquals(0, eventBus.listenerCount("chat-9"));
        assertEquals(0, eventBus.channelCount());
    }

    @Test
    @DisplayName("pings reach every open stream")
    void pingAll() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        SseStreamingService pinging = withEmitter(eventBus, emitter);
        pinging.createEmitter("managers");

        pinging.pingAll();

        verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    @DisplayName("frame carries message id, payload and timestamp in order")
    void frame() {
        Map<String, Object> frame = SseStreamingService.frame(alert("managers"));
        assertEquals(List.of("message_id", "intent", "timestamp"), List.copyOf(frame.keySet()));
        assertEquals("MSG-2026-000003", frame.get("message_id"));
        assertEquals("2026-03-01T08:15:00Z", frame.get("timestamp"));
    }

    @Test
    @DisplayName("shutdown closes every stream")
    void shutdownClosesStreams() {
        service.createEmitter("managers");
        service.createEmitter("chat-2");

        service.shutdown();

        assertEquals(0, service.openStreamCount());
        assertEquals(0, eventBus.channelCount());
    }

    @Test
    @DisplayName("concurrent publishing does not throw")
    void concurrentPublish() throws InterruptedException {
        service.createEmitter("managers");

        int threads = 4;
        CountDownLatch latch = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                for (int i = 0; i < 25; i++) {
                    eventBus.publish(alert("managers"));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
