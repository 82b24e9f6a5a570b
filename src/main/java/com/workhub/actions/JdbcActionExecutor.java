package com.workhub.actions;

import com.workhub.actions.ActionDetailsResolver.AttendanceDetails;
import com.workhub.actions.ActionDetailsResolver.PermissionDetails;
import com.workhub.actions.ActionDetailsResolver.Severity;
import com.workhub.actions.ActionDetailsResolver.TaskProgress;
import com.workhub.core.model.DatabaseAction;
import com.workhub.core.model.EntitySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Applies routed actions to the operational PostgreSQL schema.
 * <p>
 * Works against the existing {@code tasks}, {@code incidents},
 * {@code permission_requests} and {@code attendance} tables; it never creates them.
 * Sender ids must be numeric user ids.
 */
public class JdbcActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcActionExecutor.class);

    private static final int NOTES_LIMIT = 255;
    private static final long FALLBACK_MANAGER_ID = 1L;

    private static final String ACTIVE_TASK_SQL = """
            SELECT id FROM tasks
            WHERE ? = ANY(assigned_to) AND status IN ('upcoming', 'ongoing')
            ORDER BY created_at DESC LIMIT 1
            """;

    private static final String UPDATE_TASK_SQL = """
            UPDATE tasks SET status = ?, updated_at = NOW() WHERE id = ?
            """;

    private static final String INSERT_INCIDENT_SQL = """
            INSERT INTO incidents (reported_by, description, severity, status, created_at)
            VALUES (?, ?, ?, 'open', NOW())
            RETURNING id
            """;

    private static final String TEAM_MANAGER_SQL = """
            SELECT m.id FROM users u
            JOIN users m ON u.team_id = m.team_id
            WHERE u.id = ? AND m.role = 'Manager'
            LIMIT 1
            """;

    private static final String INSERT_PERMISSION_SQL = """
            INSERT INTO permission_requests
            (user_id, manager_id, request_type, title, description, priority, is_urgent, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, 'pending')
            RETURNING id
            """;

    private static final String TODAY_ATTENDANCE_SQL = """
            SELECT id FROM attendance
            WHERE user_id = ? AND DATE(created_at) = CURRENT_DATE
            ORDER BY created_at DESC LIMIT 1
            """;

    private static final String CHECK_IN_SQL = """
            UPDATE attendance
            SET check_in_time = NOW(), status = 'present', location = ?, notes = ?, updated_at = NOW()
            WHERE id = ?
            """;

    private static final String CHECK_OUT_SQL = """
            UPDATE attendance
            SET check_out_time = NOW(), status = 'absent', notes = ?, updated_at = NOW()
            WHERE id = ?
            """;

    private static final String BREAK_START_SQL = """
            UPDATE attendance
            SET break_start = NOW(), status = 'on_break', notes = ?, updated_at = NOW()
            WHERE id = ?
            """;

    private static final String BREAK_END_SQL = """
            UPDATE attendance
            SET break_end = NOW(), status = 'present', notes = ?, updated_at = NOW()
            WHERE id = ?
            """;

    private static final String INSERT_ATTENDANCE_SQL = """
            INSERT INTO attendance (user_id, check_in_time, status, location, notes)
            VALUES (?, NOW(), 'present', ?, ?)
            """;

    private final DataSource dataSource;
    private final ActionDetailsResolver resolver;

    public JdbcActionExecutor(DataSource dataSource, ActionDetailsResolver resolver) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.resolver = resolver;
    }

    @Override
    public ActionExecutionResult execute(DatabaseAction action, String senderId, String text, EntitySet entities) {
        if (action == DatabaseAction.ROUTE_TO_SUPPORT || action == DatabaseAction.LOG_GENERAL_MESSAGE) {
            log.info("{} from worker {}: {}", action.label(), senderId, text);
            return ActionExecutionResult.ok(action, "logged");
        }

        long userId;
        try {
            userId = Long.parseLong(senderId.trim());
        } catch (NumberFormatException e) {
            log.warn("Cannot run {} for non-numeric sender id '{}'", action.label(), senderId);
            return ActionExecutionResult.failed(action, "sender id is not a numeric user id");
        }

        try (Connection conn = dataSource.getConnection()) {
            return switch (action) {
                case UPDATE_TASK_PROGRESS -> updateTaskProgress(conn, userId, text);
                case CREATE_INCIDENT_RECORD -> createIncident(conn, userId, text);
                case CREATE_PERMISSION_REQUEST -> createPermissionRequest(conn, userId, text, entities);
                case UPDATE_ATTENDANCE_RECORD -> updateAttendance(conn, userId, text, entities);
                case ROUTE_TO_SUPPORT, LOG_GENERAL_MESSAGE -> ActionExecutionResult.ok(action, "logged");
            };
        } catch (SQLException e) {
            log.warn("Action {} failed for worker {}: {}", action.label(), senderId, e.getMessage());
            return ActionExecutionResult.failed(action, "database error: " + e.getMessage());
        }
    }

    private ActionExecutionResult updateTaskProgress(Connection conn, long userId, String text) throws SQLException {
        TaskProgress progress = resolver.taskProgress(text);
        Long taskId = null;
        try (PreparedStatement stmt = conn.prepareStatement(ACTIVE_TASK_SQL)) {
            stmt.setLong(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    taskId = rs.getLong(1);
                }
            }
        }
        if (taskId == null) {
            log.info("No active task found for worker {}", userId);
            return ActionExecutionResult.failed(DatabaseAction.UPDATE_TASK_PROGRESS, "no active task for worker");
        }
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_TASK_SQL)) {
            stmt.setString(1, progress.status());
            stmt.setLong(2, taskId);
            stmt.executeUpdate();
        }
        log.info("Updated task {} to {} ({}%)", taskId, progress.status(), progress.percent());
        return ActionExecutionResult.ok(DatabaseAction.UPDATE_TASK_PROGRESS,
                "task " + taskId + " " + progress.status());
    }

    private ActionExecutionResult createIncident(Connection conn, long userId, String text) throws SQLException {
        Severity severity = resolver.severity(text);
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_INCIDENT_SQL)) {
            stmt.setLong(1, userId);
            stmt.setString(2, text);
            stmt.setString(3, severity.label());
            long incidentId = returnedId(stmt);
            log.info("Created incident #{} with severity {}", incidentId, severity.label());
            return ActionExecutionResult.ok(DatabaseAction.CREATE_INCIDENT_RECORD,
                    "incident " + incidentId + " (" + severity.label() + ")");
        }
    }

    private ActionExecutionResult createPermissionRequest(Connection conn, long userId, String text,
                                                          EntitySet entities) throws SQLException {
        PermissionDetails details = resolver.permission(text, entities);
        long managerId = FALLBACK_MANAGER_ID;
        try (PreparedStatement stmt = conn.prepareStatement(TEAM_MANAGER_SQL)) {
            stmt.setLong(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    managerId = rs.getLong(1);
                }
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_PERMISSION_SQL)) {
            stmt.setLong(1, userId);
            stmt.setLong(2, managerId);
            stmt.setString(3, details.kind().label());
            stmt.setString(4, details.title());
            stmt.setString(5, text);
            stmt.setString(6, details.priority());
            stmt.setBoolean(7, details.urgent());
            long requestId = returnedId(stmt);
            log.info("Created permission request #{} ({}) for manager {}", requestId, details.kind().label(), managerId);
            return ActionExecutionResult.ok(DatabaseAction.CREATE_PERMISSION_REQUEST,
                    "permission request " + requestId + " (" + details.kind().label() + ")");
        }
    }

    private ActionExecutionResult updateAttendance(Connection conn, long userId, String text,
                                                   EntitySet entities) throws SQLException {
        AttendanceDetails details = resolver.attendance(text, entities);
        String notes = notes(text);

        Long recordId = null;
        try (PreparedStatement stmt = conn.prepareStatement(TODAY_ATTENDANCE_SQL)) {
            stmt.setLong(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    recordId = rs.getLong(1);
                }
            }
        }

        if (recordId == null) {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_ATTENDANCE_SQL)) {
                stmt.setLong(1, userId);
                stmt.setString(2, details.location());
                stmt.setString(3, notes);
                stmt.executeUpdate();
            }
        } else {
            switch (details.kind()) {
                case CHECK_IN -> {
                    try (PreparedStatement stmt = conn.prepareStatement(CHECK_IN_SQL)) {
                        stmt.setString(1, details.location());
                        stmt.setString(2, notes);
                        stmt.setLong(3, recordId);
                        stmt.executeUpdate();
                    }
                }
                case CHECK_OUT -> updateWithNotes(conn, CHECK_OUT_SQL, notes, recordId);
                case BREAK_START -> updateWithNotes(conn, BREAK_START_SQL, notes, recordId);
                case BREAK_END -> updateWithNotes(conn, BREAK_END_SQL, notes, recordId);
            }
        }
        log.info("Attendance {} recorded for worker {}", details.kind().label(), userId);
        return ActionExecutionResult.ok(DatabaseAction.UPDATE_ATTENDANCE_RECORD, details.kind().label());
    }

    private static void updateWithNotes(Connection conn, String sql, String notes, long recordId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, notes);
            stmt.setLong(2, recordId);
            stmt.executeUpdate();
        }
    }

    private static long returnedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("INSERT ... RETURNING id produced no row");
            }
            return rs.getLong(1);
        }
    }

    /** First {@value #NOTES_LIMIT} code points of the text; never splits a surrogate pair. */
    static String notes(String text) {
        if (text.codePointCount(0, text.length()) <= NOTES_LIMIT) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, NOTES_LIMIT));
    }

}
