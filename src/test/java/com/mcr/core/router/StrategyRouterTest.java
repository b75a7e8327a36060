package com.mcr.core.router;

import com.mcr.core.error.BackendException;
import com.mcr.core.metrics.McrMetrics;
import com.mcr.core.performance.InMemoryPerformanceStore;
import com.mcr.core.performance.PerformanceRecord;
import com.mcr.core.performance.PerformanceStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StrategyRouterTest {

    private InMemoryPerformanceStore store;
    private RouterProperties properties;
    private SimpleMeterRegistry registry;
    private StrategyRouter router;

    @BeforeEach
    void setUp() {
        store = new InMemoryPerformanceStore();
        properties = new RouterProperties();
        registry = new SimpleMeterRegistry();
        router = newRouter(store);
    }

    private StrategyRouter newRouter(PerformanceStore performanceStore) {
        return new StrategyRouter(new InputClassifier(), performanceStore, properties, new McrMetrics(registry));
    }

    private static PerformanceRecord record(String hash, InputClass type, boolean success, Long latency, Long cost,
                                            String model) {
        return new PerformanceRecord(hash, null, type, Map.of("exactMatchProlog", success),
                latency, cost, model, null);
    }

    @Nested
    @DisplayName("route")
    class Route {

        @Test
        @DisplayName("no history means no recommendation")
        void noHistory() {
            assertNull(router.route("Who is Bob's father?", "openai"));
            assertEquals(1, registry.find("mcr.router.decisions").tag("result", "none").counter().count());
        }

        @Test
        @DisplayName("the strategy with more successes wins")
        void successWins() {
            store.append(record("h-wrong", InputClass.QUERY, false, 500L, 400L, null));
            store.append(record("h-right", InputClass.QUERY, true, 500L, 400L, null));

            assertEquals("h-right", router.route("Who is Bob's father?", "openai"));
        }

        @Test
        @DisplayName("a fast failure does not outrank a slower success")
        void zeroLatencyFailure() {
            store.append(new PerformanceRecord("fast-fail", null, InputClass.QUERY,
                    Map.of("exactMatchProlog", false), 0L, null, null, null));
            store.append(new PerformanceRecord("slow-ok", null, InputClass.QUERY,
                    Map.of("exactMatchProlog", true), 100L, null, null, null));

            assertEquals("slow-ok", router.route("Who?", null));
        }

        @Test
        @DisplayName("the lower-latency strategy wins when both succeed")
        void lowerLatencyWins() {
            store.append(record("A", InputClass.QUERY, true, 100L, 50L, null));
            store.append(record("A", InputClass.QUERY, true, 100L, 50L, null));
            store.append(record("B", InputClass.QUERY, true, 10000L, 50L, null));

            assertEquals("A", router.route("Who is Bob's father?", null));
        }

        @Test
        @DisplayName("routing twice without new records gives the same answer")
        void idempotent() {
            store.append(record("h-1", InputClass.QUERY, true, 300L, 20L, null));
            store.append(record("h-2", InputClass.QUERY, true, 300L, 20L, null));
            store.append(record("h-3", InputClass.QUERY, false, 10L, 5L, null));

            String first = router.route("Who is Bob's father?", "openai");

            assertNotNull(first);
            assertEquals(first, router.route("Who is Bob's father?", "openai"));
        }

        @Test
        @DisplayName("records of other input classes are ignored")
        void inputClassFilter() {
            store.append(record("h-assert", InputClass.ASSERT, true, 10L, 10L, null));

            assertNull(router.route("Who is Bob's father?", null));
            assertEquals("h-assert", router.route("Tom is Bob's father.", null));
        }

        @Test
        @DisplayName("records of other models are ignored; model-agnostic records apply")
        void modelFilter() {
            store.append(record("h-other", InputClass.QUERY, true, 10L, 10L, "ollama:llama3"));
            store.append(record("h-agnostic", InputClass.QUERY, false, 100L, 100L, null));

            assertEquals("h-agnostic", router.route("Who?", "openai"));
            assertEquals("h-other", router.route("Who?", "ollama:llama3"));
            assertEquals("h-other", router.route("Who?", null));
        }

        @Test
        @DisplayName("a disabled router recommends nothing")
        void disabled() {
            store.append(record("h", InputClass.QUERY, true, 10L, 10L, null));
            properties.setEnabled(false);

            assertNull(router.route("Who?", null));
        }

        @Test
        @DisplayName("store failures yield no recommendation")
        void storeFailure() {
            PerformanceStore failing = mock(PerformanceStore.class);
            when(failing.query(any(), any(InputClass.class))).thenThrow(new BackendException("connection refused"));

            assertNull(newRouter(failing).route("Who?", "openai"));
        }
    }

    @Nested
    @DisplayName("scores")
    class Scores {

        @Test
        @DisplayName("equal scores are ranked by lower latency")
        void latencyTieBreak() {
            properties.getWeights().setLatency(0);
            properties.getWeights().setCost(0);
            store.append(record("h-slow", InputClass.QUERY, true, 900L, null, null));
            store.append(record("h-quick", InputClass.QUERY, true, 100L, null, null));

            List<StrategyScore> scores = router.scores(InputClass.QUERY, null);

            assertEquals(List.of("h-quick", "h-slow"), scores.stream().map(StrategyScore::strategyHash).toList());
            assertEquals(scores.get(0).meanScore(), scores.get(1).meanScore());
        }

        @Test
        @DisplayName("equal scores are ranked by more successes")
        void successCountTieBreak() {
            properties.getWeights().setLatency(0);
            properties.getWeights().setCost(0);
            store.append(new PerformanceRecord("h-once", null, InputClass.QUERY,
                    Map.of("exactMatchProlog", true, "exactMatchAnswer", true), 100L, null, null, null));
            store.append(new PerformanceRecord("h-once", null, InputClass.QUERY,
                    Map.of("exactMatchProlog", false), 100L, null, null, null));
            store.append(record("h-twice", InputClass.QUERY, true, 100L, null, null));
            store.append(record("h-twice", InputClass.QUERY, true, 100L, null, null));

            List<StrategyScore> scores = router.scores(InputClass.QUERY, null);

            assertEquals(scores.get(0).meanScore(), scores.get(1).meanScore());
            assertEquals("h-twice", scores.get(0).strategyHash());
            assertEquals(2, scores.get(0).successCount());
            assertEquals(1, scores.get(1).successCount());
        }

        @Test
        @DisplayName("aggregates means over the known values only")
        void aggregates() {
            store.append(record("h", InputClass.QUERY, true, 100L, null, null));
            store.append(record("h", InputClass.QUERY, false, 300L, 50L, null));
            store.append(record("h", InputClass.QUERY, true, null, null, null));

            StrategyScore score = router.scores(InputClass.QUERY, null).get(0);

            assertEquals(3, score.samples());
            assertEquals(2, score.successCount());
            assertEquals(200.0, score.meanLatencyMs());
            assertEquals(50.0, score.meanCost());
        }

        @Test
        @DisplayName("composite score combines success, latency and cost")
        void composite() {
            PerformanceRecord r = record("h", InputClass.QUERY, true, 999L, 999L, null);

            double success = router.successScore(r);

            assertEquals(1.0, success);
            assertEquals(100 + 10 + 1, router.composite(r, success), 1e-9);
            assertEquals(0 + 10 + 1, router.composite(record("h", InputClass.QUERY, false, null, null, null), 0), 1e-9);
        }

        @Test
        @DisplayName("zero or negative latency and cost score like unknown ones")
        void nonPositiveLatencyAndCost() {
            assertEquals(0 + 10 + 1, router.composite(record("h", InputClass.QUERY, false, 0L, 0L, null), 0), 1e-9);
            assertEquals(0 + 10 + 1, router.composite(record("h", InputClass.QUERY, false, -1L, -5L, null), 0), 1e-9);
            assertEquals(1.0, StrategyRouter.inverse(null));
            assertEquals(500.0, StrategyRouter.inverse(1L));
        }
    }

    @Test
    @DisplayName("only true and the number 1 count as a match")
    void truthiness() {
        assertTrue(StrategyRouter.isTruthy(true));
        assertTrue(StrategyRouter.isTruthy(1));
        assertTrue(StrategyRouter.isTruthy(1.0));
        assertFalse(StrategyRouter.isTruthy(0.5));
        assertFalse(StrategyRouter.isTruthy(2));
        assertFalse(StrategyRouter.isTruthy("true"));
        assertFalse(StrategyRouter.isTruthy(List.of()));
        assertFalse(StrategyRouter.isTruthy(null));
        assertFalse(StrategyRouter.isTruthy(0));
        assertFalse(StrategyRouter.isTruthy(false));
    }
}
