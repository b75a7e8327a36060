package com.mcr.core.engine;

/**
 * Per-request overrides.
 *
 * @param strategyId strategy to run instead of the routed or default one, nullable
 * @param style      tone of generated answers, e.g. "conversational" or "formal"
 */
public record RequestOptions(String strategyId, String style) {

    public static final String DEFAULT_STYLE = "conversational";

    public RequestOptions {
        style = style == null || style.isBlank() ? DEFAULT_STYLE : style;
    }

    public static RequestOptions defaults() {
        return new RequestOptions(null, null);
    }

    public static RequestOptions withStrategy(String strategyId) {
        return new RequestOptions(strategyId, null);
    }
}
