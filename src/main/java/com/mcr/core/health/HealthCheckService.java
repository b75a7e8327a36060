package com.mcr.core.health;

import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.performance.PerformanceStore;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ReasonerResult;
import com.mcr.core.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ReasonerBackend reasoner;
    private final BackendInvoker invoker;
    private final PerformanceStore performanceStore;
    private final StrategyRegistry strategyRegistry;
    private final EmbeddingBackend embeddingBackend;

    public HealthCheckService(ReasonerBackend reasoner,
                              BackendInvoker invoker,
                              PerformanceStore performanceStore,
                              StrategyRegistry strategyRegistry,
                              @Autowired(required = false) EmbeddingBackend embeddingBackend) {
        this.reasoner = reasoner;
        this.invoker = invoker;
        this.performanceStore = performanceStore;
        this.strategyRegistry = strategyRegistry;
        this.embeddingBackend = embeddingBackend;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkReasoner());
        results.add(checkEmbedding());
        results.add(checkPerformanceStore());
        results.add(checkStrategies());
        return results;
    }

    /**
     * DOWN if any component is down, DEGRADED if any is degraded, otherwise UP.
     */
    public static HealthStatus.Status overall(List<HealthStatus> statuses) {
        var overall = HealthStatus.Status.UP;
        for (HealthStatus status : statuses) {
            if (status.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            if (status.status() == HealthStatus.Status.DEGRADED) {
                overall = HealthStatus.Status.DEGRADED;
            }
        }
        return overall;
    }

    private HealthStatus checkReasoner() {
        try {
            ReasonerResult result = invoker.reasoner(() -> reasoner.query("", "true."));
            if (result.hasResults()) {
                return new HealthStatus("reasoner", HealthStatus.Status.UP,
                        "Reasoner answers queries", Map.of("type", reasoner.getClass().getSimpleName()));
            }
            return new HealthStatus("reasoner", HealthStatus.Status.DOWN,
                    "Reasoner returned no answer to a trivial query", Map.of());
        } catch (RuntimeException e) {
            log.warn("Reasoner health check failed: {}", e.getMessage());
            return new HealthStatus("reasoner", HealthStatus.Status.DOWN,
                    "Reasoner error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkEmbedding() {
        if (embeddingBackend == null) {
            return new HealthStatus("embedding", HealthStatus.Status.DEGRADED,
                    "No embedding backend configured; default confidence applies", Map.of());
        }
        return new HealthStatus("embedding", HealthStatus.Status.UP,
                "Embedding backend available (" + embeddingBackend.getClass().getSimpleName() + ")", Map.of());
    }

    private HealthStatus checkPerformanceStore() {
        try {
            long count = performanceStore.count();
            return new HealthStatus("performance-store", HealthStatus.Status.UP,
                    "Performance store reachable", Map.of("store", performanceStore.describe(),
                    "records", String.valueOf(count)));
        } catch (RuntimeException e) {
            log.warn("Performance store health check failed: {}", e.getMessage());
            return new HealthStatus("performance-store", HealthStatus.Status.DOWN,
                    "Performance store error: " + e.getMessage(), Map.of("store", performanceStore.describe()));
        }
    }

    private HealthStatus checkStrategies() {
        int size = strategyRegistry.size();
        if (size == 0) {
            return new HealthStatus("strategies", HealthStatus.Status.DOWN,
                    "No strategies loaded", Map.of());
        }
        return new HealthStatus("strategies", HealthStatus.Status.UP,
                size + " strategies loaded", Map.of("count", String.valueOf(size)));
    }
}
