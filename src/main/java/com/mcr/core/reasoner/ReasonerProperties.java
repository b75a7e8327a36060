package com.mcr.core.reasoner;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mcr.reasoner")
public class ReasonerProperties {

    /** Maximum resolution depth before a branch is pruned. */
    private int maxDepth = 256;

    /** Maximum number of solutions collected per query. */
    private int maxSolutions = 100;

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxSolutions() {
        return maxSolutions;
    }

    public void setMaxSolutions(int maxSolutions) {
        this.maxSolutions = maxSolutions;
    }
}
