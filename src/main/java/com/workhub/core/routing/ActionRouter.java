package com.workhub.core.routing;

import com.workhub.core.config.AgentProperties;
import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.DatabaseAction;
import com.workhub.core.model.EntityCategory;
import com.workhub.core.model.EntitySet;
import com.workhub.core.model.Intent;
import com.workhub.core.model.RoutingDecision;
import org.springframework.stereotype.Component;

/**
 * Maps a classified message to its persistence action and decides on escalation.
 * <p>
 * Total over all intents. Incidents and permission requests always need a
 * manager; any other intent does when confidence is below the escalation
 * threshold or an urgency entity mentions "urgent".
 */
@Component
public class ActionRouter {

    private final double escalationThreshold;
    private final double autoProcessThreshold;

    public ActionRouter(AgentProperties properties) {
        this.escalationThreshold = properties.escalationThreshold();
        this.autoProcessThreshold = properties.autoProcessThreshold();
    }

    public RoutingDecision route(ClassificationResult classification, EntitySet entities) {
        Intent intent = classification.intent();
        double confidence = classification.confidence();

        boolean managerAttention = alwaysEscalated(intent)
                || confidence < escalationThreshold
                || entities.mentions(EntityCategory.URGENCY, "urgent");

        return new RoutingDecision(actionFor(intent), managerAttention, confidence > autoProcessThreshold);
    }

    public static DatabaseAction actionFor(Intent intent) {
        return switch (intent) {
            case TASK_UPDATE -> DatabaseAction.UPDATE_TASK_PROGRESS;
            case INCIDENT_REPORT -> DatabaseAction.CREATE_INCIDENT_RECORD;
            case PERMISSION_REQUEST -> DatabaseAction.CREATE_PERMISSION_REQUEST;
            case ATTENDANCE -> DatabaseAction.UPDATE_ATTENDANCE_RECORD;
            case QUESTION -> DatabaseAction.ROUTE_TO_SUPPORT;
            case GENERAL -> DatabaseAction.LOG_GENERAL_MESSAGE;
        };
    }

    private static boolean alwaysEscalated(Intent intent) {
        return intent == Intent.INCIDENT_REPORT || intent == Intent.PERMISSION_REQUEST;
    }
}
