package com.mcr.core.strategy;

import com.mcr.core.artifact.ArtifactType;

import java.io.Serializable;

public record ArtifactSpec(String name, ArtifactType type) implements Serializable {}
