package com.mcr.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing MCR-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String STRATEGY_ID = "strategyId";
    public static final String REQUEST_CLASS = "requestClass";
    public static final String ITERATION = "iteration";

    private MdcContext() {}

    public static void setRequest(String sessionId, String requestClass) {
        putIfPresent(SESSION_ID, sessionId);
        putIfPresent(REQUEST_CLASS, requestClass);
    }

    public static void setStrategy(String strategyId) {
        putIfPresent(STRATEGY_ID, strategyId);
    }

    public static void setIteration(int iteration) {
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    public static void clearIteration() {
        MDC.remove(ITERATION);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(STRATEGY_ID);
        MDC.remove(REQUEST_CLASS);
        MDC.remove(ITERATION);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
