package com.workhub.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing message-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMessage(String messageId, String senderId) {
        MDC.put("messageId", messageId);
        MDC.put("senderId", senderId);
    }

    public static void clear() {
        MDC.remove("messageId");
        MDC.remove("senderId");
    }
}
