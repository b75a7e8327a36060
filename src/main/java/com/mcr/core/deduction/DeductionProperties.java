package com.mcr.core.deduction;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mcr.deduction")
public class DeductionProperties {

    /** Answer questions through hypothesis generation rather than the translated query alone. */
    private boolean guided = true;

    /** Minimum probability for a hypothesis result to be kept. */
    private double threshold = 0.5;

    /** Probability given to results when no embedding backend is usable. */
    private double defaultConfidence = 0.9;

    /** Upper bound on candidate queries requested from the generative backend. */
    private int maxHypotheses = 5;

    public boolean isGuided() {
        return guided;
    }

    public void setGuided(boolean guided) {
        this.guided = guided;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    public int getMaxHypotheses() {
        return maxHypotheses;
    }

    public void setMaxHypotheses(int maxHypotheses) {
        this.maxHypotheses = maxHypotheses;
    }
}
