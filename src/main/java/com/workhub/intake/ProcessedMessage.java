package com.workhub.intake;

import com.workhub.actions.ActionExecutionResult;
import com.workhub.core.model.AgentOutcome;

public record ProcessedMessage(AgentOutcome outcome, ActionExecutionResult actionResult) {}
