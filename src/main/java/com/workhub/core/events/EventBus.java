package com.workhub.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory channel bus carrying manager alerts ({@code managers}) and chat
 * replies ({@code chat-<chatId>}) to whoever is listening right now.
 * <p>
 * Nothing is buffered: an event published on a channel without listeners is dropped.
 * A channel's entry is removed as soon as its last listener unsubscribes, so
 * short-lived chat channels do not accumulate.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<WorkhubEvent>>> listenersByChannel = new ConcurrentHashMap<>();

    /**
     * Delivers the event to every current listener of its channel.
     * A listener that throws is logged and skipped.
     *
     * @return number of listeners that received the event without throwing
     */
    public int publish(WorkhubEvent event) {
        List<Consumer<WorkhubEvent>> listeners = listenersByChannel.get(event.channel());
        if (listeners == null) {
            log.debug("No listeners on {}; dropping {}", event.channel(), event.eventType());
            return 0;
        }
        int delivered = 0;
        for (Consumer<WorkhubEvent> listener : listeners) {
            try {
                listener.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Listener on {} failed for {}: {}", event.channel(), event.eventType(), e.getMessage(), e);
            }
        }
        return delivered;
    }

    public Subscription subscribe(String channel, Consumer<WorkhubEvent> listener) {
        listenersByChannel.compute(channel, (k, listeners) -> {
            List<Consumer<WorkhubEvent>> target = listeners == null ? new CopyOnWriteArrayList<>() : listeners;
            target.add(listener);
            return target;
        });
        log.debug("Listener added on {}", channel);
        return () -> listenersByChannel.computeIfPresent(channel, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public int listenerCount(String channel) {
        List<Consumer<WorkhubEvent>> listeners = listenersByChannel.get(channel);
        return listeners == null ? 0 : listeners.size();
    }

    /** Channels that currently have at least one listener. */
    public int channelCount() {
        return listenersByChannel.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
