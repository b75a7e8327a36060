package com.mcr.dispatch.api;

import java.util.List;

public record FactsRequest(List<String> facts) {}
