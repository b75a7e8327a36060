package com.mcr.core.refine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mcr.refinement")
public class RefinementProperties {

    /** Upper bound on translate-validate-repair iterations per request. */
    private int maxIterations = 3;

    /** Whether assertions and queries run inside the refinement loop. */
    private boolean enabled = true;

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
