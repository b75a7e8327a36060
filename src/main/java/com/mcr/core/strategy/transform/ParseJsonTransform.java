package com.mcr.core.strategy.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.llm.LlmParseException;
import com.mcr.core.strategy.StepInput;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Extracts the JSON document from generated text as a {@code SIR_JSON} artifact.
 */
@Component
public class ParseJsonTransform implements TransformFunction {

    public static final String NAME = "parse_json";

    private final ObjectMapper objectMapper;

    public ParseJsonTransform(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Artifact apply(StepInput input, Map<String, String> params) {
        Artifact source = input.first();
        if (source.type() == ArtifactType.SIR_JSON) {
            return source;
        }
        String text = source.asText();
        String json = TextExtraction.extractJson(text);
        if (json == null) {
            throw new LlmParseException("No JSON found in generated text: " + abbreviate(text));
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            return Artifact.of(ArtifactType.SIR_JSON, node);
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Generated JSON is malformed: " + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
