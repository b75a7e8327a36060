package com.mcr.core.router;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "mcr.router")
public class RouterProperties {

    private boolean enabled = true;

    private Weights weights = new Weights();

    /** Weight of each truthy metric in the success score. */
    private Map<String, Double> metricWeights = new LinkedHashMap<>(Map.of(
            "exactMatchProlog", 1.0,
            "exactMatchAnswer", 1.0,
            "prologStructureMatch", 0.5));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public Map<String, Double> getMetricWeights() {
        return metricWeights;
    }

    public void setMetricWeights(Map<String, Double> metricWeights) {
        this.metricWeights = metricWeights;
    }

    /**
     * Weights of the composite score: {@code success * s + latency * l + cost * c}.
     */
    public static class Weights {
        private double success = 100;
        private double latency = 10;
        private double cost = 1;

        public double getSuccess() {
            return success;
        }

        public void setSuccess(double success) {
            this.success = success;
        }

        public double getLatency() {
            return latency;
        }

        public void setLatency(double latency) {
            this.latency = latency;
        }

        public double getCost() {
            return cost;
        }

        public void setCost(double cost) {
            this.cost = cost;
        }
    }
}
