package com.workhub.dispatch.api;

import com.workhub.core.events.EventBus;
import com.workhub.core.events.WorkhubEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams one {@link EventBus} channel to one SSE client.
 * <p>
 * A stream is closed, and its bus listener removed, when the client goes away:
 * on emitter completion, timeout or error, or on the first failed write. Manager
 * dashboards are pinged with an SSE comment so proxies keep idle connections open.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** A manager dashboard stays open for a whole shift. */
    private static final long SHIFT_TIMEOUT_MS = TimeUnit.HOURS.toMillis(8);

    private static final long PING_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Set<ChannelStream> openStreams = ConcurrentHashMap.newKeySet();
    private ScheduledExecutorService pinger;

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, SHIFT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startPinging() {
        pinger = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sse-ping");
            t.setDaemon(true);
            return t;
        });
        pinger.scheduleAtFixedRate(this::pingAll, PING_INTERVAL_SECONDS, PING_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        if (pinger != null) {
            pinger.shutdownNow();
        }
        openStreams.forEach(ChannelStream::close);
    }

    /**
     * Opens a stream of every event published on {@code channel} from now on.
     */
    public SseEmitter createEmitter(String channel) {
        ChannelStream stream = new ChannelStream(channel, openEmitter(timeoutMs));
        openStreams.add(stream);
        stream.subscribe();
        stream.emitter.onCompletion(stream::close);
        stream.emitter.onTimeout(stream::close);
        stream.emitter.onError(ex -> stream.close());

        stream.write(SseEmitter.event().comment("connected"));
        log.info("SSE stream opened on {} ({} open)", channel, openStreams.size());
        return stream.emitter;
    }

    public int openStreamCount() {
        return openStreams.size();
    }

    SseEmitter openEmitter(long timeout) {
        return new SseEmitter(timeout);
    }

    void pingAll() {
        openStreams.forEach(stream -> stream.write(SseEmitter.event().comment("ping")));
    }

    /** SSE data for one event: the message id, the payload keys, then the timestamp. */
    static Map<String, Object> frame(WorkhubEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message_id", event.messageId());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private final class ChannelStream {

        private final String channel;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private EventBus.Subscription subscription;

        ChannelStream(String channel, SseEmitter emitter) {
            this.channel = channel;
            this.emitter = emitter;
        }

        void subscribe() {
            subscription = eventBus.subscribe(channel, event ->
                    write(SseEmitter.event().name(event.eventType()).data(frame(event))));
        }

        void write(SseEmitter.SseEventBuilder event) {
            if (closed.get()) {
                return;
            }
            try {
                emitter.send(event);
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE write on {} failed, closing stream: {}", channel, e.getMessage());
                close();
            }
        }

        void close() {
            if (closed.compareAndSet(false, true)) {
                if (subscription != null) {
                    subscription.unsubscribe();
                }
                openStreams.remove(this);
                log.debug("SSE stream on {} closed", channel);
            }
        }
    }
}
