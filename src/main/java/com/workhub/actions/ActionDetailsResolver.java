package com.workhub.actions;

import com.workhub.core.model.EntityCategory;
import com.workhub.core.model.EntitySet;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the record details for each action from the message text.
 * <p>
 * All rules are plain substring checks on the lower-cased text, evaluated in a
 * fixed order; the first rule that matches wins.
 */
@Component
public class ActionDetailsResolver {

    private static final Map<String, Integer> PROGRESS_KEYWORDS = progressKeywords();

    private static final Map<String, Severity> SEVERITY_KEYWORDS = severityKeywords();

    private static final Set<String> URGENT_MARKERS = Set.of("urgent", "emergency", "asap");

    public TaskProgress taskProgress(String text) {
        String lower = lower(text);
        for (var entry : PROGRESS_KEYWORDS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                int percent = entry.getValue();
                return new TaskProgress(percent, percent == 100 ? "completed" : "ongoing");
            }
        }
        return new TaskProgress(0, "ongoing");
    }

    public Severity severity(String text) {
        String lower = lower(text);
        for (var entry : SEVERITY_KEYWORDS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return Severity.LOW;
    }

    public PermissionDetails permission(String text, EntitySet entities) {
        String lower = lower(text);
        PermissionKind kind = PermissionKind.GENERAL;
        for (PermissionKind candidate : PermissionKind.values()) {
            if (candidate.keywords.stream().anyMatch(lower::contains)) {
                kind = candidate;
                break;
            }
        }
        boolean urgent = entities.get(EntityCategory.URGENCY).stream().anyMatch(URGENT_MARKERS::contains);
        return new PermissionDetails(kind, urgent);
    }

    public AttendanceDetails attendance(String text, EntitySet entities) {
        String lower = lower(text);
        AttendanceKind kind = AttendanceKind.CHECK_IN;
        for (AttendanceKind candidate : AttendanceKind.values()) {
            if (candidate.keywords.stream().anyMatch(lower::contains)) {
                kind = candidate;
                break;
            }
        }
        List<String> locations = entities.get(EntityCategory.LOCATIONS);
        return new AttendanceDetails(kind, locations.isEmpty() ? "" : locations.get(0));
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /** Keyword to percent complete, checked in insertion order. */
    private static Map<String, Integer> progressKeywords() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("started", 10);
        map.put("begun", 15);
        map.put("beginning", 10);
        map.put("progress", 50);
        map.put("halfway", 50);
        map.put("almost", 80);
        map.put("completed", 100);
        map.put("finished", 100);
        map.put("done", 100);
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Severity> severityKeywords() {
        Map<String, Severity> map = new LinkedHashMap<>();
        map.put("emergency", Severity.CRITICAL);
        map.put("urgent", Severity.CRITICAL);
        map.put("critical", Severity.CRITICAL);
        map.put("serious", Severity.HIGH);
        map.put("danger", Severity.HIGH);
        map.put("safety", Severity.HIGH);
        map.put("injury", Severity.HIGH);
        map.put("fire", Severity.CRITICAL);
        map.put("gas", Severity.CRITICAL);
        map.put("problem", Severity.MEDIUM);
        map.put("issue", Severity.MEDIUM);
        map.put("broken", Severity.MEDIUM);
        return Collections.unmodifiableMap(map);
    }

    public record TaskProgress(int percent, String status) {}

    public enum Severity {
        LOW, MEDIUM, HIGH, CRITICAL;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum PermissionKind {
        OVERTIME("overtime", "Overtime Request", List.of("overtime", "extra hours", "weekend", "holiday")),
        VACATION("vacation", "Vacation Request", List.of("vacation", "leave", "time off", "holiday")),
        SICK_LEAVE("sick_leave", "Sick Leave Request", List.of("sick", "ill", "medical")),
        SPECIAL_ACCESS("special_access", "Special Access Request", List.of("access", "permission", "authorization")),
        GENERAL("general", "General Permission Request", List.of());

        private final String label;
        private final String title;
        private final List<String> keywords;

        PermissionKind(String label, String title, List<String> keywords) {
            this.label = label;
            this.title = title;
            this.keywords = keywords;
        }

        public String label() {
            return label;
        }

        public String title() {
            return title;
        }
    }

    /**
     * @param urgent whether an urgency entity marks the request as urgent, emergency or asap
     */
    public record PermissionDetails(PermissionKind kind, boolean urgent) {
        public String title() {
            return kind.title();
        }

        public String priority() {
            return urgent ? "urgent" : "normal";
        }
    }

    public enum AttendanceKind {
        CHECK_IN("check_in", List.of("check in", "checked in", "arrived", "here", "present")),
        CHECK_OUT("check_out", List.of("check out", "leaving", "going home", "finished")),
        BREAK_START("break_start", List.of("break", "lunch", "rest")),
        BREAK_END("break_end", List.of("back", "return", "resume"));

        private final String label;
        private final List<String> keywords;

        AttendanceKind(String label, List<String> keywords) {
            this.label = label;
            this.keywords = keywords;
        }

        public String label() {
            return label;
        }
    }

    public record AttendanceDetails(AttendanceKind kind, String location) {}
}
