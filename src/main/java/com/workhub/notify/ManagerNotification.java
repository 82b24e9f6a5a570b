package com.workhub.notify;

import com.workhub.core.model.AgentOutcome;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert sent to supervisors when a message needs their attention.
 */
public record ManagerNotification(
        String messageId,
        String intent,
        String senderId,
        String messageText,
        double confidence,
        String action,
        Instant timestamp
) {

    public static ManagerNotification from(AgentOutcome outcome) {
        return new ManagerNotification(
                outcome.message().messageId(),
                outcome.intent().label(),
                outcome.message().senderId(),
                outcome.message().text(),
                outcome.confidence(),
                outcome.action().label(),
                Instant.now());
    }

    /** Wire payload using the field names managers' dashboards expect. */
    public Map<String, Object> payload() {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("intent", intent);
        payload.put("sender_id", senderId);
        payload.put("message_text", messageText);
        payload.put("confidence", confidence);
        payload.put("action", action);
        payload.put("timestamp", timestamp.toString());
        return payload;
    }
}
