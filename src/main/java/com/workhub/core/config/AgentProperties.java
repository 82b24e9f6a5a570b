package com.workhub.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Decision thresholds of the message pipeline. Bound once at startup and never mutated.
 *
 * @param acceptanceThreshold   a model classification is accepted only above this confidence
 * @param escalationThreshold   results below this confidence are escalated to a manager
 * @param autoProcessThreshold  results above this confidence are flagged for automatic processing
 * @param lowConfidenceNotice   appended to the reply when confidence is below the escalation threshold
 */
@ConfigurationProperties(prefix = "workhub.agent")
public record AgentProperties(
        @DefaultValue("0.4") double acceptanceThreshold,
        @DefaultValue("0.5") double escalationThreshold,
        @DefaultValue("0.6") double autoProcessThreshold,
        @DefaultValue("(I'm not 100% sure what you meant, so I've flagged this for manager review)")
        String lowConfidenceNotice
) {

    public static AgentProperties defaults() {
        return new AgentProperties(0.4, 0.5, 0.6,
                "(I'm not 100% sure what you meant, so I've flagged this for manager review)");
    }
}
