package com.mcr.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mcr.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    /**
     * Identifier under which performance records are filed and looked up.
     */
    public String modelId() {
        if (model == null || model.isBlank()) {
            return provider;
        }
        return provider + ":" + model;
    }
}
