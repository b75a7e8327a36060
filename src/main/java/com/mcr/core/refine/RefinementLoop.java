package com.mcr.core.refine;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.ErrorCategory;
import com.mcr.core.error.McrException;
import com.mcr.core.error.RefinementExhaustedException;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.logging.MdcContext;
import com.mcr.core.metrics.McrMetrics;
import com.mcr.core.prompt.PromptTemplate;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ValidationResult;
import com.mcr.core.session.SessionContext;
import com.mcr.core.strategy.transform.TextExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bounded translate, validate and repair loop.
 * <p>
 * Iteration one runs the operation. Each iteration validates the current
 * candidate; the first valid one is returned as converged. An invalid candidate
 * is recorded in the history and, while iterations remain, handed to the
 * generative backend with the {@code REFINE_FOR_CONSISTENCY} prompt, whose reply
 * becomes the next candidate. When the session holds fact embeddings the prompt
 * names the stored fact closest to the failed candidate.
 * <p>
 * A failing operation counts as a failed iteration and is re-run on the next
 * one; on the last iteration it ends the loop with
 * {@link RefinementExhaustedException}. A backend failure while validating is
 * treated the same way. A failed repair call is noted in that iteration's
 * history entry and drops the candidate so the operation re-runs. Configuration and not-found failures propagate
 * immediately. Running out of iterations returns the last candidate with
 * {@code converged = false}.
 */
@Service
public class RefinementLoop {

    private static final Logger log = LoggerFactory.getLogger(RefinementLoop.class);

    private final GenerativeBackend generativeBackend;
    private final ReasonerBackend reasoner;
    private final BackendInvoker invoker;
    private final PromptTemplates prompts;
    private final RefinementProperties properties;
    private final McrMetrics metrics;
    private final EmbeddingBackend embeddingBackend;

    public RefinementLoop(GenerativeBackend generativeBackend,
                          ReasonerBackend reasoner,
                          BackendInvoker invoker,
                          PromptTemplates prompts,
                          RefinementProperties properties,
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

    public RefinementResult refine(RefinementOperation operation, String input, SessionContext context) {
        return refine(operation, input, context, properties.getMaxIterations(), this::validateWithReasoner);
    }

    public RefinementResult refine(RefinementOperation operation, String input, SessionContext context,
                                   int maxIterations) {
        return refine(operation, input, context, maxIterations, this::validateWithReasoner);
    }

    public RefinementResult refine(RefinementOperation operation, String input, SessionContext context,
                                   int maxIterations, CandidateValidator validator) {
        int limit = Math.max(1, maxIterations);
        List<RefinementAttempt> history = new ArrayList<>();
        Artifact candidate = null;
        Artifact lastCandidate = null;
        int iteration = 0;

        try {
            while (iteration < limit) {
                iteration++;
                MdcContext.setIteration(iteration);

                if (candidate == null) {
                    try {
                        candidate = operation.apply(input, context);
                    } catch (McrException e) {
                        if (!e.isRetryable()) {
                            throw e;
                        }
                        history.add(new RefinementAttempt(iteration, e.getMessage()));
                        log.warn("Refinement iteration {}/{}: operation failed: {}", iteration, limit, e.getMessage());
                        if (iteration == limit) {
                            metrics.recordRefinement(iteration, false);
                            throw new RefinementExhaustedException("Operation failed on final iteration "
                                    + iteration + ": " + e.getMessage(), history, e);
                        }
                        continue;
                    }
                }

                ValidationResult validation;
                try {
                    validation = validate(validator, candidate);
                } catch (McrException e) {
                    if (!e.isRetryable()) {
                        throw e;
                    }
                    history.add(new RefinementAttempt(iteration, e.getMessage()));
                    log.warn("Refinement iteration {}/{}: validation failed: {}", iteration, limit, e.getMessage());
                    lastCandidate = candidate;
                    candidate = null;
                    if (iteration == limit) {
                        metrics.recordRefinement(iteration, false);
                        throw new RefinementExhaustedException("Validation failed on final iteration "
                                + iteration + ": " + e.getMessage(), history, e);
                    }
                    continue;
                }
                if (validation.valid()) {
                    log.info("Refinement converged after {} iteration(s)", iteration);
                    metrics.recordRefinement(iteration, true);
                    return new RefinementResult(candidate, iteration, true, history);
                }

                String error = validation.error() == null || validation.error().isBlank()
                        ? "validation failed" : validation.error();
                history.add(new RefinementAttempt(iteration, error));
                log.info("Refinement iteration {}/{} invalid: {}", iteration, limit, error);
                lastCandidate = candidate;
                candidate = null;

                if (iteration == limit) {
                    break;
                }

                String repaired;
                try {
                    repaired = repair(input, lastCandidate, error, iteration, context);
                } catch (McrException e) {
                    if (!e.isRetryable()) {
                        throw e;
                    }
                    log.warn("Repair call failed on iteration {}; re-running operation: {}", iteration, e.getMessage());
                    history.set(history.size() - 1,
                            new RefinementAttempt(iteration, error + "; repair failed: " + e.getMessage()));
                    continue;
                }
                if (repaired == null || repaired.isBlank()) {
                    log.info("Repair produced no text on iteration {}; stopping", iteration);
                    break;
                }
                candidate = fromRepair(repaired, lastCandidate);
            }
        } finally {
            MdcContext.clearIteration();
        }

        metrics.recordRefinement(iteration, false);
        log.warn("Refinement did not converge after {} iteration(s)", iteration);
        return new RefinementResult(lastCandidate, iteration, false, history);
    }

    /**
     * Validates clause sets and single clauses as a knowledge base and queries as
     * goals. Other artifact types are accepted as they are.
     */
    public ValidationResult validateWithReasoner(Artifact candidate) {
        ArtifactType type = candidate.type();
        if (type == ArtifactType.FORMAL_KB || type == ArtifactType.FORMAL_CLAUSE) {
            String text = candidate.asText();
            if (text.isBlank()) {
                return ValidationResult.invalid("No clauses produced");
            }
            return invoker.reasoner(() -> reasoner.validate(text));
        }
        if (type == ArtifactType.FORMAL_QUERY) {
            String query = candidate.asText();
            if (query.isBlank()) {
                return ValidationResult.invalid("No query produced");
            }
            return invoker.reasoner(() -> reasoner.validateQuery(query));
        }
        return ValidationResult.ok();
    }

    /**
     * Validation errors reported as exceptions count as an invalid candidate.
     * Backend failures are rethrown for the loop to handle.
     */
    private static ValidationResult validate(CandidateValidator validator, Artifact candidate) {
        try {
            return validator.validate(candidate);
        } catch (McrException e) {
            if (e.getCategory() != ErrorCategory.VALIDATION) {
                throw e;
            }
            return ValidationResult.invalid(e.getMessage());
        }
    }

    private String repair(String input, Artifact failed, String error, int iteration, SessionContext context) {
        PromptTemplate template = prompts.get("REFINE_FOR_CONSISTENCY");
        Map<String, String> vars = Map.of(
                "originalInput", input == null ? "" : input,
                "failedOutput", failed.asText(),
                "validationError", error,
                "iteration", String.valueOf(iteration),
                "similarContext", similarContext(failed.asText(), context));
        return invoker.generative(() -> generativeBackend.generate(
                template.renderSystem(vars), template.renderUser(vars)));
    }

    /**
     * The stored fact most similar to the failed output. Ties keep the first fact.
     */
    String similarContext(String failedText, SessionContext context) {
        if (context == null || !context.hasEmbeddings() || embeddingBackend == null) {
            return "None available.";
        }
        float[] failedVector;
        try {
            failedVector = invoker.embedding(() -> embeddingBackend.encode(failedText));
        } catch (McrException e) {
            log.warn("Could not embed failed output for repair context: {}", e.getMessage());
            return "None available.";
        }
        String bestFact = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, float[]> entry : context.embeddings().entrySet()) {
            double score = embeddingBackend.similarity(failedVector, entry.getValue());
            if (score > bestScore) {
                bestScore = score;
                bestFact = entry.getKey();
            }
        }
        if (bestFact == null) {
            return "None available.";
        }
        return String.format(Locale.ROOT, "%s (similarity %.3f)", bestFact, bestScore);
    }

    /**
     * Reads repaired text back as a candidate of the failed candidate's type, or
     * {@code null} when that type has no textual form, in which case the
     * operation runs again.
     */
    static Artifact fromRepair(String repaired, Artifact failed) {
        ArtifactType type = failed.type();
        Map<String, String> metadata = Map.of("source", "repair");
        return switch (type) {
            case FORMAL_KB -> Artifact.of(type, TextExtraction.extractClauses(repaired), metadata);
            case FORMAL_QUERY -> Artifact.of(type, TextExtraction.normalizeQuery(repaired), metadata);
            case FORMAL_CLAUSE -> Artifact.of(type, TextExtraction.stripCodeFence(repaired), metadata);
            default -> null;
        };
    }
}
