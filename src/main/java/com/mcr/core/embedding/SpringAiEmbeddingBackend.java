package com.mcr.core.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingBackend} over Spring AI's {@link EmbeddingModel}. Only
 * registered when {@code mcr.embedding.enabled=true}; every consumer treats the
 * embedding backend as optional.
 */
@Service
@ConditionalOnProperty(prefix = "mcr.embedding", name = "enabled", havingValue = "true")
public class SpringAiEmbeddingBackend implements EmbeddingBackend {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingBackend.class);

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingBackend(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        log.info("Embedding backend enabled ({})", embeddingModel.getClass().getSimpleName());
    }

    @Override
    public float[] encode(String text) {
        float[] vector = embeddingModel.embed(text);
        log.debug("Embedded {} chars into {} dimensions", text.length(), vector.length);
        return vector;
    }
}
