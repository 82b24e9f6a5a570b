package com.workhub.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Bounds every outbound model call with connect and read timeouts.
 * <p>
 * Spring AI builds its OpenAI-compatible client from the auto-configured
 * {@code RestClient.Builder}, so a {@link RestClientCustomizer} is enough to
 * apply the limits from {@link LlmProperties}.
 */
@Configuration
public class LlmHttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmHttpClientConfig.class);

    @Bean
    RestClientCustomizer llmTimeouts(LlmProperties properties) {
        log.info("Model HTTP timeouts: connect={}, read={}", properties.connectTimeout(), properties.readTimeout());
        return builder -> {
            var factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(properties.connectTimeout());
            factory.setReadTimeout(properties.readTimeout());
            builder.requestFactory(factory);
        };
    }
}
