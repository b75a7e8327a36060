package com.mcr.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body for POST /api/v1/sessions.
 */
public record SessionRequest(@JsonProperty("session_id") String sessionId) {}
