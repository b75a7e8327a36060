package com.mcr.core.performance;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link PerformanceStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), records
 * go to a {@link JdbcPerformanceStore}. Otherwise an in-memory store is used,
 * which keeps history for the life of the process only.
 */
@Configuration
public class PerformanceStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(PerformanceStoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public PerformanceStore jdbcPerformanceStore(DataSource dataSource, ObjectMapper objectMapper) throws SQLException {
        log.info("Configuring JDBC performance store");
        var store = new JdbcPerformanceStore(dataSource, objectMapper);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(PerformanceStore.class)
    public PerformanceStore inMemoryPerformanceStore() {
        log.info("No DataSource available; using in-memory performance store (history will not persist across restarts)");
        return new InMemoryPerformanceStore();
    }
}
