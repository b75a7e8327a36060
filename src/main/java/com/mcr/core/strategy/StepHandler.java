package com.mcr.core.strategy;

import com.mcr.core.artifact.Artifact;

/**
 * Executes one kind of step action. Failures propagate to the caller unchanged.
 *
 * @param <A> the action record this handler understands
 */
public interface StepHandler<A extends StepAction> {

    StepKind kind();

    Class<A> actionType();

    Artifact handle(Step step, A action, StepInput input);
}
