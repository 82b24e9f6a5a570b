package com.workhub.notify;

import com.workhub.core.events.EventBus;
import com.workhub.core.events.WorkhubEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Publishes manager alerts on the in-memory {@link EventBus}, where SSE clients
 * subscribed to the {@code managers} channel pick them up.
 */
@Service
public class EventBusManagerNotifier implements ManagerNotifier {

    public static final String MANAGERS_CHANNEL = "managers";
    public static final String ALERT_EVENT = "manager.alert";

    private static final Logger log = LoggerFactory.getLogger(EventBusManagerNotifier.class);

    private final EventBus eventBus;

    public EventBusManagerNotifier(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void notify(ManagerNotification notification) {
        log.info("Alerting managers: {} from worker {} ({})",
                notification.intent(), notification.senderId(), notification.action());
        int dashboards = eventBus.publish(new WorkhubEvent(ALERT_EVENT, MANAGERS_CHANNEL, notification.messageId(),
                notification.payload(), notification.timestamp()));
        if (dashboards == 0) {
            log.info("No manager dashboard connected; alert for message {} was not delivered", notification.messageId());
        }
    }
}
