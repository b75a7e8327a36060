package com.mcr.core.deduction;

import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.McrException;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.metrics.McrMetrics;
import com.mcr.core.prompt.PromptTemplate;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ReasonerResult;
import com.mcr.core.strategy.transform.TextExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Answers questions by blending symbolic query results with embedding similarity.
 * <p>
 * Guided deduction asks the generative backend for candidate queries, runs each
 * against the knowledge base and scores every result by its similarity to the
 * question. Results below the threshold are dropped. When nothing survives, a
 * deterministic query runs instead and its results carry probability 1.0.
 * Without a usable embedding backend results get the configured default
 * confidence.
 */
@Service
public class ConfidenceWeightedDeduction {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceWeightedDeduction.class);

    private final GenerativeBackend generativeBackend;
    private final ReasonerBackend reasoner;
    private final BackendInvoker invoker;
    private final PromptTemplates prompts;
    private final DeductionProperties properties;
    private final McrMetrics metrics;
    private final EmbeddingBackend embeddingBackend;

    public ConfidenceWeightedDeduction(GenerativeBackend generativeBackend,
                                       ReasonerBackend reasoner,
                                       BackendInvoker invoker,
                                       PromptTemplates prompts,
                                       DeductionProperties properties,
                                       McrMetrics metrics,
                                       @Autowired(required = false) EmbeddingBackend embeddingBackend) {
        this.generativeBackend = generativeBackend;
        this.reasoner = reasoner;
        this.invoker = invoker;
        this.prompts = prompts;
        this.properties = properties;
        this.metrics = metrics;
        this.embeddingBackend = embeddingBackend;
    }

    public List<ScoredProof> deduceGuided(String question, String knowledgeBase, double threshold) {
        return deduceGuided(question, knowledgeBase, threshold, null);
    }

    /**
     * @param fallbackQuery deterministic query used when no hypothesis clears the
     *                      threshold; {@code null} translates the question with {@code NL_TO_QUERY}
     */
    public List<ScoredProof> deduceGuided(String question, String knowledgeBase, double threshold,
                                          String fallbackQuery) {
        List<String> hypotheses = hypothesize(question, knowledgeBase);
        log.debug("Evaluating {} hypothesis queries", hypotheses.size());

        var scorer = new Scorer(question);
        List<ScoredProof> kept = new ArrayList<>();
        for (String hypothesis : hypotheses) {
            ReasonerResult result;
            try {
                result = invoker.reasoner(() -> reasoner.query(knowledgeBase, hypothesis));
            } catch (McrException e) {
                log.warn("Hypothesis {} failed in the reasoner, skipping: {}", hypothesis, e.getMessage());
                continue;
            }
            for (String answer : result.results()) {
                double probability = scorer.score(answer);
                if (probability >= threshold) {
                    kept.add(new ScoredProof(hypothesis, answer, probability));
                }
            }
        }
        if (!kept.isEmpty()) {
            log.info("Guided deduction kept {} proof(s) from {} hypotheses", kept.size(), hypotheses.size());
            return kept;
        }
        return fallback(question, knowledgeBase, fallbackQuery);
    }

    /**
     * Queries the subset of {@code clauses} whose similarity to the query is at
     * least {@code threshold}.
     */
    public ReasonerResult selectClauses(List<String> clauses, String query, double threshold) {
        var scorer = new Scorer(query);
        List<String> selected = new ArrayList<>();
        for (String clause : clauses) {
            if (scorer.score(clause) >= threshold) {
                selected.add(clause);
            }
        }
        log.debug("Selected {} of {} clauses for {}", selected.size(), clauses.size(), query);
        String reduced = String.join("\n", selected);
        return invoker.reasoner(() -> reasoner.query(reduced, query));
    }

    private List<String> hypothesize(String question, String knowledgeBase) {
        PromptTemplate template = prompts.get("HYPOTHESIZE_QUERIES");
        Map<String, String> vars = Map.of(
                "maxHypotheses", String.valueOf(properties.getMaxHypotheses()),
                "knowledgeBase", knowledgeBase,
                "naturalLanguageQuestion", question);
        String reply;
        try {
            reply = invoker.generative(() ->
                    generativeBackend.generate(template.renderSystem(vars), template.renderUser(vars)));
        } catch (McrException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            log.warn("Hypothesis generation failed: {}", e.getMessage());
            return List.of();
        }
        return TextExtraction.stripCodeFence(reply).lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("%"))
                .map(TextExtraction::normalizeQuery)
                .filter(q -> !q.isEmpty() && !q.contains(":-"))
                .distinct()
                .limit(Math.max(1, properties.getMaxHypotheses()))
                .toList();
    }

    private List<ScoredProof> fallback(String question, String knowledgeBase, String fallbackQuery) {
        String query = fallbackQuery != null && !fallbackQuery.isBlank()
                ? TextExtraction.normalizeQuery(fallbackQuery)
                : translate(question, knowledgeBase);
        metrics.recordDeductionFallback();
        log.info("No hypothesis cleared the threshold; falling back to {}", query);
        ReasonerResult result = invoker.reasoner(() -> reasoner.query(knowledgeBase, query));
        return result.results().stream()
                .map(answer -> new ScoredProof(query, answer, 1.0))
                .toList();
    }

    private String translate(String question, String knowledgeBase) {
        PromptTemplate template = prompts.get("NL_TO_QUERY");
        Map<String, String> vars = Map.of(
                "existingFacts", knowledgeBase,
                "naturalLanguageQuestion", question);
        return TextExtraction.normalizeQuery(invoker.generative(() ->
                generativeBackend.generate(template.renderSystem(vars), template.renderUser(vars))));
    }

    /**
     * Scores texts against one reference. The reference is embedded at most once;
     * any embedding failure switches to the default confidence for the rest of the call.
     */
    private final class Scorer {

        private final String reference;
        private float[] referenceVector;
        private boolean degraded;

        Scorer(String reference) {
            this.reference = reference;
            this.degraded = embeddingBackend == null;
        }

        double score(String text) {
            if (!degraded && referenceVector == null) {
                referenceVector = embed(reference);
            }
            if (!degraded) {
                float[] vector = embed(text);
                if (vector != null) {
                    return embeddingBackend.similarity(referenceVector, vector);
                }
            }
            String reason = embeddingBackend == null ? "no_backend" : "embedding_failed";
            log.debug("Using default confidence {} for '{}' ({})", properties.getDefaultConfidence(), text, reason);
            metrics.recordDefaultConfidence(reason);
            return properties.getDefaultConfidence();
        }

        private float[] embed(String text) {
            try {
                return invoker.embedding(() -> embeddingBackend.encode(text));
            } catch (McrException e) {
                log.warn("Embedding failed, using default confidence {}: {}",
                        properties.getDefaultConfidence(), e.getMessage());
                degraded = true;
                return null;
            }
        }
    }
}
