package com.workhub.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of things a worker message can mean.
 * <p>
 * Declaration order is also the tie-break priority of the rule-based classifier:
 * when two intents score equally, the one declared first wins.
 */
public enum Intent {
    TASK_UPDATE("task_update"),
    INCIDENT_REPORT("incident_report"),
    PERMISSION_REQUEST("permission_request"),
    ATTENDANCE("attendance"),
    QUESTION("question"),
    GENERAL("general");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    /** Wire label, e.g. {@code task_update}. */
    public String label() {
        return label;
    }

    /**
     * Looks up an intent by its wire label. Matching ignores case and surrounding whitespace.
     */
    public static Optional<Intent> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.label.equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
