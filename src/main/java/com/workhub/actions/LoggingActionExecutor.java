package com.workhub.actions;

import com.workhub.core.model.DatabaseAction;
import com.workhub.core.model.EntitySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records actions in the application log only. Used when no database is configured.
 */
public class LoggingActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoggingActionExecutor.class);

    private final ActionDetailsResolver resolver;

    public LoggingActionExecutor(ActionDetailsResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public ActionExecutionResult execute(DatabaseAction action, String senderId, String text, EntitySet entities) {
        String detail = switch (action) {
            case UPDATE_TASK_PROGRESS -> {
                var progress = resolver.taskProgress(text);
                yield "task " + progress.status() + " (" + progress.percent() + "%)";
            }
            case CREATE_INCIDENT_RECORD -> "incident (" + resolver.severity(text).label() + ")";
            case CREATE_PERMISSION_REQUEST -> {
                var permission = resolver.permission(text, entities);
                yield permission.title() + " (" + permission.priority() + ")";
            }
            case UPDATE_ATTENDANCE_RECORD -> "attendance " + resolver.attendance(text, entities).kind().label();
            case ROUTE_TO_SUPPORT, LOG_GENERAL_MESSAGE -> "logged";
        };
        log.info("[no database] {} for worker {}: {}", action.label(), senderId, detail);
        return ActionExecutionResult.ok(action, detail);
    }
}
