package com.mcr.core.strategy.transform;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.strategy.StepInput;

import java.util.Map;

/**
 * A deterministic transform a strategy step can invoke by name.
 */
public interface TransformFunction {

    String name();

    Artifact apply(StepInput input, Map<String, String> params);
}
