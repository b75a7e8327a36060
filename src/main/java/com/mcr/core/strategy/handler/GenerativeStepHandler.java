package com.mcr.core.strategy.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.error.InvalidOutputShapeException;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.llm.LlmParseException;
import com.mcr.core.prompt.PromptTemplate;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.strategy.Step;
import com.mcr.core.strategy.StepAction;
import com.mcr.core.strategy.StepHandler;
import com.mcr.core.strategy.StepInput;
import com.mcr.core.strategy.StepKind;
import com.mcr.core.strategy.transform.TextExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fills the step's prompt template from the run's artifacts, calls the
 * generative backend and wraps the reply as the declared target type.
 */
@Component
public class GenerativeStepHandler implements StepHandler<StepAction.Generative> {

    private static final Logger log = LoggerFactory.getLogger(GenerativeStepHandler.class);

    private final GenerativeBackend backend;
    private final PromptTemplates prompts;
    private final BackendInvoker invoker;
    private final ObjectMapper objectMapper;

    public GenerativeStepHandler(GenerativeBackend backend, PromptTemplates prompts,
                                 BackendInvoker invoker, ObjectMapper objectMapper) {
        this.backend = backend;
        this.prompts = prompts;
        this.invoker = invoker;
        this.objectMapper = objectMapper;
    }

    @Override
    public StepKind kind() {
        return StepKind.GENERATIVE;
    }

    @Override
    public Class<StepAction.Generative> actionType() {
        return StepAction.Generative.class;
    }

    @Override
    public Artifact handle(Step step, StepAction.Generative action, StepInput input) {
        PromptTemplate template = prompts.get(action.template());
        Map<String, String> vars = input.templateVariables();
        String system = template.renderSystem(vars);
        String user = template.renderUser(vars);

        String reply = invoker.generative(() -> backend.generate(system, user));
        log.debug("Step {} ({}) generated {} chars", step.id(), template.name(), reply.length());

        Map<String, String> metadata = Map.of("template", template.name(), "step", step.id());
        return Artifact.of(action.targetType(), convert(action.targetType(), reply), metadata);
    }

    private Object convert(ArtifactType target, String reply) {
        return switch (target) {
            case NL_TEXT, UNTYPED -> reply.trim();
            case FORMAL_CLAUSE -> TextExtraction.stripCodeFence(reply);
            case FORMAL_QUERY -> TextExtraction.normalizeQuery(reply);
            case FORMAL_KB -> TextExtraction.extractClauses(reply);
            case SIR_JSON -> parseJson(reply);
            default -> throw new InvalidOutputShapeException("A generative step cannot produce " + target);
        };
    }

    private JsonNode parseJson(String reply) {
        String json = TextExtraction.extractJson(reply);
        if (json == null) {
            throw new LlmParseException("Generated text holds no JSON document");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Generated JSON is malformed: " + e.getOriginalMessage(), e);
        }
    }
}
