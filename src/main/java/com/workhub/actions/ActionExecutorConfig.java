package com.workhub.actions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link ActionExecutor}: JDBC-backed when a {@link DataSource} exists
 * (the {@code postgres} profile), log-only otherwise.
 */
@Configuration
public class ActionExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutorConfig.class);

    @Bean
    public ActionExecutor actionExecutor(ObjectProvider<DataSource> dataSource, ActionDetailsResolver resolver) {
        DataSource available = dataSource.getIfAvailable();
        if (available != null) {
            log.info("Configuring JDBC action executor (PostgreSQL)");
            return new JdbcActionExecutor(available, resolver);
        }
        log.info("No DataSource available; actions will only be logged");
        return new LoggingActionExecutor(resolver);
    }
}
