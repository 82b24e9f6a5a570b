package com.workhub.intake;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound message as submitted by a chat client.
 *
 * @param chatId optional conversation id; replies are published to {@code chat-<chatId>}
 */
public record WorkerMessageRequest(
        @JsonProperty("message") String message,
        @JsonProperty("sender_id") String senderId,
        @JsonProperty("chat_id") String chatId
) {}
