package com.mcr.dispatch.api;

import com.mcr.core.llm.LlmProperties;
import com.mcr.core.performance.PerformanceRecord;
import com.mcr.core.router.InputClass;
import com.mcr.core.router.InputClassifier;
import com.mcr.core.router.StrategyRouter;
import com.mcr.core.router.StrategyScore;
import com.mcr.core.strategy.StrategyGraph;
import com.mcr.core.strategy.StrategyRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the strategy catalogue, routing decisions and the
 * performance history behind them.
 */
@RestController
@RequestMapping("/api/v1/strategies")
public class StrategyController {

    private final StrategyRegistry registry;
    private final StrategyRouter router;
    private final InputClassifier classifier;
    private final LlmProperties llmProperties;

    public StrategyController(StrategyRegistry registry, StrategyRouter router,
                              InputClassifier classifier, LlmProperties llmProperties) {
        this.registry = registry;
        this.router = router;
        this.classifier = classifier;
        this.llmProperties = llmProperties;
    }

    @GetMapping
    public List<Map<String, Object>> list() {
        return registry.all().stream().map(this::summary).toList();
    }

    @GetMapping("/{strategyId}")
    public StrategyGraph get(@PathVariable String strategyId) {
        return registry.get(strategyId);
    }

    /**
     * POST /api/v1/strategies/route: Which strategy the router would pick for a text.
     */
    @PostMapping("/route")
    public Map<String, Object> route(@RequestBody RouteRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        String modelId = request.modelId() != null ? request.modelId() : llmProperties.modelId();
        String hash = router.route(request.text(), modelId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("input_class", classifier.classify(request.text()).value());
        result.put("model_id", modelId);
        result.put("strategy_hash", hash);
        result.put("strategy_id", registry.findByHash(hash).map(StrategyGraph::getId).orElse(null));
        return result;
    }

    @GetMapping("/performance")
    public List<StrategyScore> performance(@RequestParam("input_type") String inputType,
                                           @RequestParam(value = "model_id", required = false) String modelId) {
        return router.scores(InputClass.fromValue(inputType), modelId);
    }

    @PostMapping("/performance")
    public ResponseEntity<Map<String, Object>> recordPerformance(@RequestBody PerformanceRecordRequest request) {
        if (request == null || request.inputType() == null) {
            throw new IllegalArgumentException("input_type is required");
        }
        String hash = request.strategyHash();
        if (hash == null || hash.isBlank()) {
            if (request.strategyId() == null) {
                throw new IllegalArgumentException("strategy_id or strategy_hash is required");
            }
            hash = registry.hashOf(request.strategyId());
        }
        router.recordPerformance(new PerformanceRecord(
                hash,
                request.exampleId(),
                InputClass.fromValue(request.inputType()),
                request.metrics(),
                request.latencyMs(),
                request.costTokens(),
                request.modelId(),
                null));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("strategy_hash", hash));
    }

    private Map<String, Object> summary(StrategyGraph graph) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", graph.getId());
        summary.put("name", graph.getName());
        summary.put("input_type", graph.getInputType() == null ? null : graph.getInputType().value());
        summary.put("description", graph.getDescription());
        summary.put("output_type", graph.outputType().name());
        summary.put("hash", registry.hashOf(graph.getId()));
        return summary;
    }
}
