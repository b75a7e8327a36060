package com.mcr.core.refine;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.reasoner.ValidationResult;

@FunctionalInterface
public interface CandidateValidator {

    ValidationResult validate(Artifact candidate);
}
