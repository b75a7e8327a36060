package com.mcr.core.health;

import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.backend.BackendProperties;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.BackendException;
import com.mcr.core.performance.InMemoryPerformanceStore;
import com.mcr.core.performance.PerformanceStore;
import com.mcr.core.reasoner.HornClauseReasoner;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ReasonerProperties;
import com.mcr.core.reasoner.ReasonerResult;
import com.mcr.core.strategy.StrategyRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private BackendInvoker invoker;
    private StrategyRegistry registry;

    @BeforeEach
    void setUp() {
        invoker = new BackendInvoker(new BackendProperties());
        registry = mock(StrategyRegistry.class);
        when(registry.size()).thenReturn(4);
    }

    @AfterEach
    void tearDown() {
        invoker.destroy();
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns reasoner, embedding, performance-store and strategies components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(new HornClauseReasoner(new ReasonerProperties()), invoker,
                new InMemoryPerformanceStore(), registry, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(List.of("reasoner", "embedding", "performance-store", "strategies"),
                results.stream().map(HealthStatus::component).toList());
        assertEquals(HealthStatus.Status.UP, component(results, "reasoner").status());
        assertEquals("in-memory", component(results, "performance-store").metadata().get("store"));
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "embedding").status());
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.overall(results));
    }

    @Test
    @DisplayName("Embedding backend available -> all UP")
    void allUp() {
        var service = new HealthCheckService(new HornClauseReasoner(new ReasonerProperties()), invoker,
                new InMemoryPerformanceStore(), registry, mock(EmbeddingBackend.class));

        assertEquals(HealthStatus.Status.UP, HealthCheckService.overall(service.checkAll()));
    }

    @Test
    @DisplayName("Failing reasoner, store or empty registry -> DOWN")
    void failures() {
        ReasonerBackend reasoner = mock(ReasonerBackend.class);
        when(reasoner.query(anyString(), anyString())).thenReturn(ReasonerResult.empty());
        PerformanceStore store = mock(PerformanceStore.class);
        when(store.count()).thenThrow(new BackendException("connection refused"));
        when(store.describe()).thenReturn("jdbc:mcr_performance_results");
        when(registry.size()).thenReturn(0);

        var results = new HealthCheckService(reasoner, invoker, store, registry, null).checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(results, "reasoner").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "strategies").status());
        HealthStatus storeStatus = component(results, "performance-store");
        assertEquals(HealthStatus.Status.DOWN, storeStatus.status());
        assertTrue(storeStatus.detail().contains("connection refused"));
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.overall(results));
    }

    @Test
    @DisplayName("overall of no components is UP")
    void overallEmpty() {
        assertEquals(HealthStatus.Status.UP, HealthCheckService.overall(List.of()));
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.overall(List.of(
                new HealthStatus("a", HealthStatus.Status.DEGRADED, "", Map.of()),
                new HealthStatus("b", HealthStatus.Status.DOWN, "", Map.of()))));
    }
}
