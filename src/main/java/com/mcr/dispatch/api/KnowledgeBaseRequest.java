package com.mcr.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KnowledgeBaseRequest(@JsonProperty("knowledge_base") String knowledgeBase) {}
