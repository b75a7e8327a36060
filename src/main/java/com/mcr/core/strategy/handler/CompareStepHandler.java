package com.mcr.core.strategy.handler;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.artifact.CritiqueResult;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.BackendException;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.prompt.PromptTemplate;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.strategy.Step;
import com.mcr.core.strategy.StepAction;
import com.mcr.core.strategy.StepHandler;
import com.mcr.core.strategy.StepInput;
import com.mcr.core.strategy.StepKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares the two inputs of a compare step. {@code exact} compares the
 * whitespace-normalised text, {@code embedding} the cosine similarity of the
 * encoded texts, {@code llm} asks the generative backend for a verdict.
 */
@Component
public class CompareStepHandler implements StepHandler<StepAction.Compare> {

    private final PromptTemplates prompts;
    private final BackendInvoker invoker;
    private final GenerativeBackend generativeBackend;
    private final EmbeddingBackend embeddingBackend;

    public CompareStepHandler(PromptTemplates prompts,
                              BackendInvoker invoker,
                              GenerativeBackend generativeBackend,
                              @Autowired(required = false) EmbeddingBackend embeddingBackend) {
        this.prompts = prompts;
        this.invoker = invoker;
        this.generativeBackend = generativeBackend;
        this.embeddingBackend = embeddingBackend;
    }

    @Override
    public StepKind kind() {
        return StepKind.COMPARE;
    }

    @Override
    public Class<StepAction.Compare> actionType() {
        return StepAction.Compare.class;
    }

    @Override
    public Artifact handle(Step step, StepAction.Compare action, StepInput input) {
        List<Artifact> pair = input.ordered();
        if (pair.size() != 2) {
            throw new StrategyDefinitionException("Compare step '" + step.id() + "' received "
                    + pair.size() + " inputs");
        }
        String a = pair.get(0).asText();
        String b = pair.get(1).asText();
        double threshold = action.threshold();

        CritiqueResult result = switch (action.method().toLowerCase(Locale.ROOT)) {
            case "exact" -> {
                boolean same = normalize(a).equals(normalize(b));
                yield new CritiqueResult(same ? 1.0 : 0.0, same, same ? "identical" : "texts differ");
            }
            case "embedding" -> {
                double score = embeddingSimilarity(a, b);
                yield new CritiqueResult(score, score >= threshold,
                        String.format(Locale.ROOT, "cosine %.3f against threshold %.2f", score, threshold));
            }
            case "llm" -> {
                PromptTemplate template = prompts.get("SEMANTIC_SIMILARITY_CHECK");
                Map<String, String> vars = Map.of("textA", a, "textB", b);
                String verdict = invoker.generative(() ->
                        generativeBackend.generate(template.renderSystem(vars), template.renderUser(vars)));
                boolean similar = verdict.trim().toUpperCase(Locale.ROOT).startsWith("SIMILAR");
                yield new CritiqueResult(similar ? 1.0 : 0.0, similar, verdict.trim());
            }
            default -> throw new StrategyDefinitionException("Unknown compare method '" + action.method()
                    + "' in step '" + step.id() + "'");
        };
        return Artifact.of(ArtifactType.CRITIQUE_RESULT, result, Map.of("method", action.method(), "step", step.id()));
    }

    private double embeddingSimilarity(String a, String b) {
        if (embeddingBackend == null) {
            throw new BackendException("Embedding comparison requested but no embedding backend is configured");
        }
        float[] va = invoker.embedding(() -> embeddingBackend.encode(a));
        float[] vb = invoker.embedding(() -> embeddingBackend.encode(b));
        return embeddingBackend.similarity(va, vb);
    }

    private static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }
}
