package com.mcr.core.artifact;

import java.io.Serializable;

/**
 * Outcome of comparing two artifacts.
 *
 * @param similarity score produced by the comparison method
 * @param pass       whether the score cleared the configured threshold
 * @param details    human-readable explanation
 */
public record CritiqueResult(double similarity, boolean pass, String details) implements Serializable {}
