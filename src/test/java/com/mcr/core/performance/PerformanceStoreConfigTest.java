package com.mcr.core.performance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcr.core.router.InputClass;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the store factory methods directly, without a Spring context.
 */
class PerformanceStoreConfigTest {

    private final PerformanceStoreConfig config = new PerformanceStoreConfig();

    @Test
    @DisplayName("JDBC store is created with its table ready for appends")
    void jdbcStore() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:cfg-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");

        PerformanceStore store = config.jdbcPerformanceStore(dataSource, new ObjectMapper());
        store.append(new PerformanceRecord("h", null, InputClass.ASSERT, Map.of(), 10L, null, "openai", null));

        assertInstanceOf(JdbcPerformanceStore.class, store);
        assertEquals(1, store.query(r -> true).size());
    }

    @Test
    @DisplayName("in-memory store is the fallback")
    void inMemoryStore() {
        PerformanceStore store = config.inMemoryPerformanceStore();

        assertInstanceOf(InMemoryPerformanceStore.class, store);
        assertTrue(store.query(r -> true).isEmpty());
    }
}
