package com.mcr.core.error;

/**
 * Thrown when a strategy graph is malformed: missing entry step, dangling edge,
 * cycle, or an undeclared decision point.
 */
public class StrategyDefinitionException extends McrException {

    public StrategyDefinitionException(String message) {
        super(ErrorCategory.CONFIGURATION, "INVALID_STRATEGY", message);
    }

    public StrategyDefinitionException(String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION, "INVALID_STRATEGY", message, cause);
    }
}
