package com.mcr.core.strategy;

import com.mcr.core.artifact.Artifact;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * LangGraph4j state for one strategy run.
 * <p>
 * {@code inputs} holds the initial artifacts by name, {@code outputs} the
 * artifact of every executed step by step id. Each node writes back the whole
 * outputs map; executed step ids accumulate in an appender channel.
 */
public class StrategyRunState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
        "strategyId",    Channels.base(() -> ""),
        "inputs",        Channels.base((Supplier<Map<String, Artifact>>) Map::of),
        "outputs",       Channels.base((Supplier<Map<String, Artifact>>) Map::of),
        "lastStepId",    Channels.base(() -> ""),
        "executedSteps", Channels.appender(ArrayList::new)
    );

    public StrategyRunState(Map<String, Object> initData) {
        super(initData);
    }

    public String strategyId() {
        return this.<String>value("strategyId").orElse("");
    }

    public Map<String, Artifact> inputs() {
        return this.<Map<String, Artifact>>value("inputs").orElse(Map.of());
    }

    public Map<String, Artifact> outputs() {
        return this.<Map<String, Artifact>>value("outputs").orElse(Map.of());
    }

    public String lastStepId() {
        return this.<String>value("lastStepId").orElse("");
    }

    public List<String> executedSteps() {
        return this.<List<String>>value("executedSteps").orElse(List.of());
    }
}
