package com.mcr.core.deduction;

import java.io.Serializable;

/**
 * One answer of a guided deduction.
 *
 * @param query       the query that produced it
 * @param proof       the solution, rendered as variable bindings
 * @param probability confidence in [0, 1]; exactly 1.0 for deterministic fallback answers
 */
public record ScoredProof(String query, String proof, double probability) implements Serializable {}
