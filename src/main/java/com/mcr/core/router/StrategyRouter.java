package com.mcr.core.router;

import com.mcr.core.metrics.McrMetrics;
import com.mcr.core.performance.PerformanceRecord;
import com.mcr.core.performance.PerformanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the historically best strategy for a request.
 * <p>
 * Each matching performance record gets a composite score from its matched
 * metrics, latency and token cost. Records are grouped by strategy hash and the
 * group with the highest mean wins; ties go to more successes, then lower mean
 * latency, then lower mean cost. No history means no recommendation.
 */
@Service
public class StrategyRouter {

    private static final Logger log = LoggerFactory.getLogger(StrategyRouter.class);

    private static final Comparator<StrategyScore> RANKING = Comparator
            .comparingDouble(StrategyScore::meanScore).reversed()
            .thenComparing(Comparator.comparingInt(StrategyScore::successCount).reversed())
            .thenComparing(StrategyScore::meanLatencyMs, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(StrategyScore::meanCost, Comparator.nullsLast(Comparator.naturalOrder()));

    private final InputClassifier classifier;
    private final PerformanceStore store;
    private final RouterProperties properties;
    private final McrMetrics metrics;

    public StrategyRouter(InputClassifier classifier, PerformanceStore store,
                          RouterProperties properties, McrMetrics metrics) {
        this.classifier = classifier;
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @return the hash of the recommended strategy, or {@code null} for no recommendation
     */
    public String route(String text, String modelId) {
        if (!properties.isEnabled()) {
            return null;
        }
        InputClass inputClass = classifier.classify(text);
        try {
            List<StrategyScore> ranked = scores(inputClass, modelId);
            if (ranked.isEmpty()) {
                log.debug("No performance history for {} / {}", inputClass.value(), modelId);
                metrics.recordRouterDecision(inputClass.value(), false);
                return null;
            }
            StrategyScore best = ranked.get(0);
            log.info("Router recommends {} for {} (mean {} over {} record(s))",
                    best.strategyHash(), inputClass.value(), best.meanScore(), best.samples());
            metrics.recordRouterDecision(inputClass.value(), true);
            return best.strategyHash();
        } catch (RuntimeException e) {
            log.error("Router failed for {} / {}: {}", inputClass.value(), modelId, e.getMessage(), e);
            metrics.recordRouterDecision(inputClass.value(), false);
            return null;
        }
    }

    public void recordPerformance(PerformanceRecord record) {
        store.append(record);
        log.debug("Recorded performance of {} for {}", record.strategyHash(), record.inputType().value());
    }

    /**
     * Per-strategy aggregates for one input class and model, best first.
     */
    public List<StrategyScore> scores(InputClass inputClass, String modelId) {
        Map<String, List<PerformanceRecord>> byStrategy = new LinkedHashMap<>();
        for (PerformanceRecord record : store.query(modelId, inputClass)) {
            byStrategy.computeIfAbsent(record.strategyHash(), k -> new ArrayList<>()).add(record);
        }
        List<StrategyScore> scores = new ArrayList<>();
        byStrategy.forEach((hash, records) -> scores.add(aggregate(hash, records)));
        scores.sort(RANKING);
        return scores;
    }

    private StrategyScore aggregate(String hash, List<PerformanceRecord> records) {
        double total = 0;
        int successes = 0;
        double latencySum = 0;
        int latencyCount = 0;
        double costSum = 0;
        int costCount = 0;
        for (PerformanceRecord record : records) {
            double success = successScore(record);
            total += composite(record, success);
            if (success > 0) {
                successes++;
            }
            if (record.latencyMs() != null) {
                latencySum += record.latencyMs();
                latencyCount++;
            }
            if (record.costTokens() != null) {
                costSum += record.costTokens();
                costCount++;
            }
        }
        return new StrategyScore(hash,
                total / records.size(),
                successes,
                latencyCount == 0 ? null : latencySum / latencyCount,
                costCount == 0 ? null : costSum / costCount,
                records.size());
    }

    double composite(PerformanceRecord record, double successScore) {
        double latencyScore = inverse(record.latencyMs());
        double costScore = inverse(record.costTokens());
        RouterProperties.Weights w = properties.getWeights();
        return successScore * w.getSuccess() + latencyScore * w.getLatency() + costScore * w.getCost();
    }

    /**
     * 1000 / (value + 1), or 1 when the value is unknown or not positive.
     */
    static double inverse(Long value) {
        return value == null || value <= 0 ? 1.0 : 1000.0 / (value + 1);
    }

    double successScore(PerformanceRecord record) {
        double score = 0;
        for (Map.Entry<String, Double> weight : properties.getMetricWeights().entrySet()) {
            if (isTruthy(record.metrics().get(weight.getKey()))) {
                score += weight.getValue();
            }
        }
        return score;
    }

    /**
     * A metric counts as a match only when it is {@code true} or the number 1.
     */
    static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 1.0;
        }
        return false;
    }
}
