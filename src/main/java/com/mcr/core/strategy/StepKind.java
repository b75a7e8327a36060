package com.mcr.core.strategy;

public enum StepKind {
    GENERATIVE,
    TRANSFORM,
    REASONER_QUERY,
    COMPARE
}
