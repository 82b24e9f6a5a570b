package com.workhub.actions;

import com.workhub.core.model.DatabaseAction;
import com.workhub.core.model.EntitySet;

/**
 * Carries out the persistence operation chosen by the router.
 * <p>
 * Implementations never throw for data problems; they report them in the result
 * so the worker still receives a reply.
 */
public interface ActionExecutor {

    ActionExecutionResult execute(DatabaseAction action, String senderId, String text, EntitySet entities);
}
