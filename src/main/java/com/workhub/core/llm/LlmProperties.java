package com.workhub.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Language-model endpoint settings. Immutable; the model counts as configured only
 * when it is enabled and an API key is present.
 */
@ConfigurationProperties(prefix = "workhub.llm")
public record LlmProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("") String apiKey,
        @DefaultValue("llama-3.3-70b-versatile") String model,
        @DefaultValue("0.1") double classificationTemperature,
        @DefaultValue("0.4") double responseTemperature,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("20s") Duration readTimeout
) {

    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    public static LlmProperties disabled() {
        return new LlmProperties(false, "", "llama-3.3-70b-versatile", 0.1, 0.4,
                Duration.ofSeconds(5), Duration.ofSeconds(20));
    }
}
