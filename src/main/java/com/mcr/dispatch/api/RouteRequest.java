package com.mcr.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RouteRequest(String text, @JsonProperty("model_id") String modelId) {}
