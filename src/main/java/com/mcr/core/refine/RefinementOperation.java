package com.mcr.core.refine;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.session.SessionContext;

/**
 * One translation attempt, typically a strategy run. Invoked again whenever a
 * refinement iteration has no candidate to validate.
 */
@FunctionalInterface
public interface RefinementOperation {

    Artifact apply(String input, SessionContext context);
}
