package com.mcr.core.strategy;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.error.BackendException;
import com.mcr.core.error.InvalidOutputShapeException;
import com.mcr.core.error.McrException;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.error.UnknownStepKindException;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Interprets a {@link StrategyGraph} for one request.
 * <p>
 * Each run compiles the graph into a LangGraph4j {@link StateGraph} over
 * {@link StrategyRunState}: one node per step reachable from the entry, plain
 * edges for single successors and conditional edges resolved by the
 * {@link BranchSelector} at decision points. Steps without outgoing edges lead
 * to {@code END}; the last executed step's artifact is the result. The executor
 * keeps no state between runs.
 */
@Service
public class StrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(StrategyExecutor.class);

    private final Map<StepKind, StepHandler<?>> handlers;
    private final BranchSelector branchSelector;

    @Autowired
    public StrategyExecutor(List<StepHandler<?>> handlers,
                            @Autowired(required = false) BranchSelector branchSelector) {
        this.handlers = new EnumMap<>(StepKind.class);
        for (StepHandler<?> handler : handlers) {
            this.handlers.put(handler.kind(), handler);
        }
        this.branchSelector = branchSelector;
        log.info("StrategyExecutor initialized with handlers {}", this.handlers.keySet());
    }

    public StrategyExecutor(List<StepHandler<?>> handlers) {
        this(handlers, null);
    }

    /**
     * Runs the graph and returns its terminal artifact.
     *
     * @throws InvalidOutputShapeException when the terminal artifact type differs from the declared output type
     * @throws UnknownStepKindException    when a reachable step has no registered handler
     */
    public Artifact execute(StrategyGraph graph, Map<String, Artifact> initialContext) {
        return run(graph, initialContext).output();
    }

    public StrategyRun run(StrategyGraph graph, Map<String, Artifact> initialContext) {
        long start = System.currentTimeMillis();
        checkInputs(graph, initialContext);
        CompiledGraph<StrategyRunState> compiled = compile(graph);

        Map<String, Object> initialState = Map.of(
                "strategyId", graph.getId(),
                "inputs", Map.copyOf(initialContext));

        StrategyRunState state;
        try {
            state = compiled.invoke(initialState, RunnableConfig.builder().build()).orElseThrow(() ->
                    new BackendException("Strategy " + graph.getId() + " returned no state"));
        } catch (RuntimeException e) {
            throw unwrap(graph, e);
        }

        Artifact output = state.outputs().get(state.lastStepId());
        if (output == null) {
            throw new InvalidOutputShapeException("Strategy " + graph.getId() + " produced no artifact");
        }
        if (output.type() != graph.outputType()) {
            throw new InvalidOutputShapeException("Strategy " + graph.getId() + " ended with "
                    + output.type() + " but declares " + graph.outputType());
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Strategy {} completed in {}ms via steps {}", graph.getId(), elapsed, state.executedSteps());
        return new StrategyRun(graph.getId(), output, state.outputs(), state.executedSteps(), elapsed);
    }

    private void checkInputs(StrategyGraph graph, Map<String, Artifact> initialContext) {
        for (ArtifactSpec spec : graph.getExpectedInputs()) {
            Artifact provided = initialContext.get(spec.name());
            if (provided == null) {
                throw new StrategyDefinitionException("Strategy " + graph.getId()
                        + " expects initial artifact '" + spec.name() + "'");
            }
            if (spec.type() != null && provided.type() != spec.type()) {
                throw new StrategyDefinitionException("Strategy " + graph.getId() + " expects '" + spec.name()
                        + "' as " + spec.type() + " but received " + provided.type());
            }
        }
    }

    private CompiledGraph<StrategyRunState> compile(StrategyGraph graph) {
        List<Step> reachable = graph.reachableSteps();
        for (Step step : reachable) {
            if (!handlers.containsKey(step.action().kind())) {
                throw new UnknownStepKindException("No handler registered for " + step.action().kind()
                        + " (step '" + step.id() + "' of strategy " + graph.getId() + ")");
            }
            if (graph.isDecisionPoint(step.id()) && branchSelector == null) {
                throw new StrategyDefinitionException("Step '" + step.id() + "' of strategy " + graph.getId()
                        + " is a decision point but no branch selector is configured");
            }
        }

        try {
            var stateGraph = new StateGraph<>(StrategyRunState.SCHEMA, StrategyRunState::new);
            for (Step step : reachable) {
                stateGraph.addNode(step.id(), node_async(stepNode(graph, step)));
            }
            stateGraph.addEdge(START, graph.getEntryStepId());
            for (Step step : reachable) {
                List<String> targets = graph.outgoing(step.id());
                if (targets.isEmpty()) {
                    stateGraph.addEdge(step.id(), END);
                } else if (targets.size() == 1) {
                    stateGraph.addEdge(step.id(), targets.get(0));
                } else {
                    Map<String, String> mapping = targets.stream()
                            .collect(Collectors.toMap(Function.identity(), Function.identity()));
                    stateGraph.addConditionalEdges(step.id(),
                            edge_async(state -> selectBranch(graph, step, state, targets)),
                            mapping);
                }
            }
            return stateGraph.compile(CompileConfig.builder()
                    .recursionLimit(reachable.size() + 5)
                    .build());
        } catch (GraphStateException e) {
            throw new StrategyDefinitionException("Strategy " + graph.getId() + " cannot be compiled: "
                    + e.getMessage(), e);
        }
    }

    private NodeAction<StrategyRunState> stepNode(StrategyGraph graph, Step step) {
        return state -> {
            StepInput input = resolveInputs(graph, step, state);
            log.debug("Strategy {} running step {} ({})", graph.getId(), step.id(), step.action().kind());
            Artifact output = dispatch(step, input);

            Map<String, Artifact> outputs = new LinkedHashMap<>(state.outputs());
            outputs.put(step.id(), output);
            Map<String, Object> update = new HashMap<>();
            update.put("outputs", outputs);
            update.put("lastStepId", step.id());
            update.put("executedSteps", List.of(step.id()));
            return update;
        };
    }

    @SuppressWarnings("unchecked")
    private <A extends StepAction> Artifact dispatch(Step step, StepInput input) {
        StepHandler<A> handler = (StepHandler<A>) handlers.get(step.action().kind());
        if (handler == null) {
            throw new UnknownStepKindException("No handler registered for " + step.action().kind());
        }
        return handler.handle(step, handler.actionType().cast(step.action()), input);
    }

    /**
     * Declared references resolve to prior step outputs first, then initial
     * artifacts. Without declared inputs, the entry step receives the whole
     * initial context and any other step its predecessor's output.
     */
    StepInput resolveInputs(StrategyGraph graph, Step step, StrategyRunState state) {
        Map<String, Artifact> outputs = state.outputs();
        Map<String, Artifact> initial = state.inputs();
        Map<String, Artifact> named = new LinkedHashMap<>();

        if (step.inputs().isEmpty()) {
            if (step.id().equals(graph.getEntryStepId())) {
                named.putAll(initial);
            } else {
                String previous = state.lastStepId();
                Artifact prior = outputs.get(previous);
                if (prior != null) {
                    named.put(previous, prior);
                }
            }
        } else {
            for (String ref : step.inputs()) {
                Artifact artifact = outputs.containsKey(ref) ? outputs.get(ref) : initial.get(ref);
                if (artifact == null) {
                    throw new StrategyDefinitionException("Step '" + step.id() + "' of strategy " + graph.getId()
                            + " reads '" + ref + "', which is neither a prior step output nor an initial artifact");
                }
                named.put(ref, artifact);
            }
        }

        Map<String, Artifact> available = new LinkedHashMap<>(initial);
        available.putAll(outputs);
        return new StepInput(graph.getId(), named, available);
    }

    private String selectBranch(StrategyGraph graph, Step step, StrategyRunState state, List<String> targets) {
        Artifact output = state.outputs().get(step.id());
        String chosen = branchSelector.select(graph, step, output, targets);
        if (chosen == null || !targets.contains(chosen)) {
            throw new StrategyDefinitionException("Branch selector chose '" + chosen + "' at step '" + step.id()
                    + "'; expected one of " + targets);
        }
        log.debug("Strategy {} branches from {} to {}", graph.getId(), step.id(), chosen);
        return chosen;
    }

    /**
     * Graph execution wraps node failures; the first core exception in the cause
     * chain is rethrown as-is.
     */
    private static RuntimeException unwrap(StrategyGraph graph, RuntimeException e) {
        Throwable t = e;
        while (t != null) {
            if (t instanceof McrException mcr) {
                return mcr;
            }
            t = t.getCause();
        }
        log.error("Strategy {} failed: {}", graph.getId(), e.getMessage(), e);
        return new BackendException("Strategy " + graph.getId() + " failed: " + e.getMessage(), e);
    }
}
