package com.mcr.core.refine;

import java.io.Serializable;

/**
 * One failed iteration of a refinement loop.
 */
public record RefinementAttempt(int iteration, String error) implements Serializable {}
