package com.workhub.core.model;

/**
 * Downstream persistence operation selected by the router.
 * Each value names exactly one operation of the persistence collaborator.
 */
public enum DatabaseAction {
    UPDATE_TASK_PROGRESS("update_task_progress"),
    CREATE_INCIDENT_RECORD("create_incident_record"),
    CREATE_PERMISSION_REQUEST("create_permission_request"),
    UPDATE_ATTENDANCE_RECORD("update_attendance_record"),
    ROUTE_TO_SUPPORT("route_to_support"),
    LOG_GENERAL_MESSAGE("log_general_message");

    private final String label;

    DatabaseAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
