package com.mcr.core.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.router.InputClass;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative directed graph of typed steps that translates between natural
 * language and formal logic.
 * <p>
 * Validated on construction: the entry step exists, step ids are unique, every
 * edge joins existing steps, the part of the graph reachable from the entry is
 * acyclic, compare steps declare exactly two inputs, and at least one output
 * artifact is declared. Violations raise {@link StrategyDefinitionException}.
 */
public final class StrategyGraph implements Serializable {

    private final String id;
    private final String name;
    private final InputClass inputType;
    private final String description;
    private final Map<String, Step> steps;
    private final List<Edge> edges;
    private final Map<String, List<String>> outgoing;
    private final String entryStepId;
    private final List<ArtifactSpec> expectedInputs;
    private final List<ArtifactSpec> expectedOutputs;

    @JsonCreator
    public StrategyGraph(@JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("inputType") InputClass inputType,
                         @JsonProperty("description") String description,
                         @JsonProperty("steps") List<Step> steps,
                         @JsonProperty("edges") List<Edge> edges,
                         @JsonProperty("entryStepId") String entryStepId,
                         @JsonProperty("expectedInputs") List<ArtifactSpec> expectedInputs,
                         @JsonProperty("expectedOutputs") List<ArtifactSpec> expectedOutputs) {
        if (id == null || id.isBlank()) {
            throw new StrategyDefinitionException("Strategy id must not be blank");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.inputType = inputType;
        this.description = description == null ? "" : description;
        this.entryStepId = entryStepId;
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.expectedInputs = expectedInputs == null ? List.of() : List.copyOf(expectedInputs);
        this.expectedOutputs = expectedOutputs == null ? List.of() : List.copyOf(expectedOutputs);

        var byId = new LinkedHashMap<String, Step>();
        for (Step step : steps == null ? List.<Step>of() : steps) {
            if (byId.putIfAbsent(step.id(), step) != null) {
                throw new StrategyDefinitionException("Strategy " + id + " declares step '" + step.id() + "' twice");
            }
        }
        this.steps = Collections.unmodifiableMap(byId);

        var out = new HashMap<String, List<String>>();
        for (Edge edge : this.edges) {
            if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to())) {
                throw new StrategyDefinitionException("Strategy " + id + " has an edge "
                        + edge.from() + " -> " + edge.to() + " referencing an unknown step");
            }
            out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(out);

        validate();
    }

    private void validate() {
        if (entryStepId == null || !steps.containsKey(entryStepId)) {
            throw new StrategyDefinitionException("Strategy " + id + " has no entry step '" + entryStepId + "'");
        }
        if (expectedOutputs.isEmpty() || expectedOutputs.get(0).type() == null) {
            throw new StrategyDefinitionException("Strategy " + id + " declares no output artifact type");
        }
        for (Step step : steps.values()) {
            if (step.action() instanceof StepAction.Compare && step.inputs().size() != 2) {
                throw new StrategyDefinitionException("Compare step '" + step.id() + "' in strategy " + id
                        + " must declare exactly two inputs, found " + step.inputs().size());
            }
        }
        checkAcyclic();
    }

    private void checkAcyclic() {
        Set<String> done = new LinkedHashSet<>();
        Set<String> onPath = new LinkedHashSet<>();
        visit(entryStepId, done, onPath);
    }

    private void visit(String stepId, Set<String> done, Set<String> onPath) {
        if (done.contains(stepId)) {
            return;
        }
        if (!onPath.add(stepId)) {
            throw new StrategyDefinitionException("Strategy " + id + " contains a cycle through step '" + stepId + "'");
        }
        for (String next : outgoing(stepId)) {
            visit(next, done, onPath);
        }
        onPath.remove(stepId);
        done.add(stepId);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public InputClass getInputType() {
        return inputType;
    }

    public String getDescription() {
        return description;
    }

    public List<Step> getSteps() {
        return List.copyOf(steps.values());
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public String getEntryStepId() {
        return entryStepId;
    }

    public List<ArtifactSpec> getExpectedInputs() {
        return expectedInputs;
    }

    public List<ArtifactSpec> getExpectedOutputs() {
        return expectedOutputs;
    }

    public Step step(String stepId) {
        Step step = steps.get(stepId);
        if (step == null) {
            throw new StrategyDefinitionException("Strategy " + id + " has no step '" + stepId + "'");
        }
        return step;
    }

    public List<String> outgoing(String stepId) {
        return outgoing.getOrDefault(stepId, List.of());
    }

    public boolean isDecisionPoint(String stepId) {
        return outgoing(stepId).size() > 1;
    }

    public ArtifactType outputType() {
        return expectedOutputs.get(0).type();
    }

    /**
     * Steps reachable from the entry step, in breadth-first order.
     */
    public List<Step> reachableSteps() {
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(entryStepId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                queue.addAll(outgoing(current));
            }
        }
        return seen.stream().map(steps::get).toList();
    }

    @Override
    public String toString() {
        return "StrategyGraph[" + id + ", " + steps.size() + " steps, entry=" + entryStepId + "]";
    }
}
