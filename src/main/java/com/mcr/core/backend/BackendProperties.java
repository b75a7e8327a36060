package com.mcr.core.backend;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Independent timeouts for each external collaborator. A zero or negative
 * duration disables the timeout for that backend.
 */
@Component
@ConfigurationProperties(prefix = "mcr.backend")
public class BackendProperties {

    private Duration generativeTimeout = Duration.ofSeconds(60);
    private Duration reasonerTimeout = Duration.ofSeconds(10);
    private Duration embeddingTimeout = Duration.ofSeconds(15);

    public Duration getGenerativeTimeout() {
        return generativeTimeout;
    }

    public void setGenerativeTimeout(Duration generativeTimeout) {
        this.generativeTimeout = generativeTimeout;
    }

    public Duration getReasonerTimeout() {
        return reasonerTimeout;
    }

    public void setReasonerTimeout(Duration reasonerTimeout) {
        this.reasonerTimeout = reasonerTimeout;
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public void setEmbeddingTimeout(Duration embeddingTimeout) {
        this.embeddingTimeout = embeddingTimeout;
    }
}
