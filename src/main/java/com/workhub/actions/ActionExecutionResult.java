package com.workhub.actions;

import com.workhub.core.model.DatabaseAction;

/**
 * Outcome of running one persistence action.
 *
 * @param action  the action that was attempted
 * @param success whether it took effect
 * @param detail  short human-readable summary or failure reason
 */
public record ActionExecutionResult(DatabaseAction action, boolean success, String detail) {

    public static ActionExecutionResult ok(DatabaseAction action, String detail) {
        return new ActionExecutionResult(action, true, detail);
    }

    public static ActionExecutionResult failed(DatabaseAction action, String detail) {
        return new ActionExecutionResult(action, false, detail);
    }
}
