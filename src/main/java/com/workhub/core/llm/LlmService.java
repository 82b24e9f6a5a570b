package com.workhub.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper around Spring AI's {@link ChatClient} for plain text completions.
 * <p>
 * Makes exactly one call per invocation; retries are disabled in configuration.
 * Failures surface as unchecked exceptions and are translated into
 * {@link com.workhub.core.classify.ModelResult} values by the callers.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;

    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized, base-url: {}, model: {}, configured: {}",
                baseUrl, properties.model(), properties.isConfigured());
    }

    /**
     * Whether a model endpoint is configured. When false, callers must skip the model entirely.
     */
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    public String modelName() {
        return properties.model();
    }

    /**
     * Sends a single user prompt and returns the trimmed reply text.
     *
     * @param prompt      the fully rendered prompt
     * @param temperature sampling temperature for this call
     * @return non-blank reply text
     * @throws LlmUnavailableException    if no model is configured
     * @throws LlmEmptyResponseException  if the model replied with blank content
     */
    public String complete(String prompt, double temperature) {
        if (!isAvailable()) {
            throw new LlmUnavailableException("No language model configured");
        }
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .options(ChatOptions.builder()
                        .model(properties.model())
                        .temperature(temperature)
                        .build())
                .user(prompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("LLM call complete ({}ms, {} chars)", elapsed, response == null ? 0 : response.length());
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content");
        }
        return response.strip();
    }
}
