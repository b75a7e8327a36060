package com.mcr.core.strategy;

import java.io.Serializable;

public record Edge(String from, String to) implements Serializable {}
