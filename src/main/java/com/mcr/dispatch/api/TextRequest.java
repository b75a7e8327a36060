package com.mcr.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for assert, query and message requests.
 *
 * @param text       natural language statement or question
 * @param strategyId strategy override; nullable, the router or the default decides otherwise
 * @param style      answer style for questions; nullable, defaults to conversational
 */
public record TextRequest(
    String text,
    @JsonProperty("strategy_id") String strategyId,
    String style
) {}
