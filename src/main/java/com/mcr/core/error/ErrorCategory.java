package com.mcr.core.error;

/**
 * Top-level failure classes. Callers branch on the category rather than the
 * concrete exception type.
 */
public enum ErrorCategory {
    /** Missing or invalid strategy graph, unknown step kind. Never retried. */
    CONFIGURATION,
    /** Generated formal text rejected by the reasoner. Drives refinement. */
    VALIDATION,
    /** Generative, reasoner or embedding call failed or timed out. */
    BACKEND,
    /** Unknown session or strategy identifier. */
    NOT_FOUND
}
