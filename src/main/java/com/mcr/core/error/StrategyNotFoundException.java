package com.mcr.core.error;

public class StrategyNotFoundException extends McrException {

    public StrategyNotFoundException(String strategyId) {
        super(ErrorCategory.NOT_FOUND, "STRATEGY_NOT_FOUND", "Strategy not found: " + strategyId);
    }
}
