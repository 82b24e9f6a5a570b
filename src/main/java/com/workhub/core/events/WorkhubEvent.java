package com.workhub.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event published for SSE streaming, e.g. a manager alert or a reply to a chat.
 *
 * @param eventType {@code manager.alert} or {@code agent.response}
 * @param channel   delivery channel, {@code managers} or {@code chat-<chatId>}
 * @param messageId the message this event relates to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record WorkhubEvent(
    String eventType,
    String channel,
    String messageId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
