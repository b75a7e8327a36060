package com.mcr.core.engine;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.deduction.ConfidenceWeightedDeduction;
import com.mcr.core.deduction.DeductionProperties;
import com.mcr.core.deduction.ScoredProof;
import com.mcr.core.error.InvalidOutputShapeException;
import com.mcr.core.error.McrException;
import com.mcr.core.events.EventBus;
import com.mcr.core.events.McrEvent;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.llm.LlmProperties;
import com.mcr.core.logging.MdcContext;
import com.mcr.core.metrics.McrMetrics;
import com.mcr.core.performance.PerformanceRecord;
import com.mcr.core.prompt.PromptTemplate;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ReasonerResult;
import com.mcr.core.refine.RefinementLoop;
import com.mcr.core.refine.RefinementProperties;
import com.mcr.core.refine.RefinementResult;
import com.mcr.core.router.InputClass;
import com.mcr.core.router.InputClassifier;
import com.mcr.core.router.StrategyRouter;
import com.mcr.core.session.SessionContext;
import com.mcr.core.session.SessionManager;
import com.mcr.core.strategy.StrategyExecutor;
import com.mcr.core.strategy.StrategyGraph;
import com.mcr.core.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Handles natural language requests against a session.
 * <p>
 * A request is classified, a strategy is chosen (explicit override, then the
 * router's recommendation, then the configured default for the class) and run
 * inside the refinement loop. Statements merge the resulting clauses into the
 * session; questions go through guided deduction and a final answer generation
 * step. Every strategy run is recorded in the performance history.
 */
@Service
public class McrEngine {

    private static final Logger log = LoggerFactory.getLogger(McrEngine.class);

    private final SessionManager sessionManager;
    private final StrategyRegistry strategyRegistry;
    private final StrategyExecutor executor;
    private final StrategyRouter router;
    private final InputClassifier classifier;
    private final RefinementLoop refinementLoop;
    private final RefinementProperties refinementProperties;
    private final ConfidenceWeightedDeduction deduction;
    private final DeductionProperties deductionProperties;
    private final ReasonerBackend reasoner;
    private final GenerativeBackend generativeBackend;
    private final BackendInvoker invoker;
    private final PromptTemplates prompts;
    private final LlmProperties llmProperties;
    private final EventBus eventBus;
    private final McrMetrics metrics;

    public McrEngine(SessionManager sessionManager,
                     StrategyRegistry strategyRegistry,
                     StrategyExecutor executor,
                     StrategyRouter router,
                     InputClassifier classifier,
                     RefinementLoop refinementLoop,
                     RefinementProperties refinementProperties,
                     ConfidenceWeightedDeduction deduction,
                     DeductionProperties deductionProperties,
                     ReasonerBackend reasoner,
                     GenerativeBackend generativeBackend,
                     BackendInvoker invoker,
                     PromptTemplates prompts,
                     LlmProperties llmProperties,
                     EventBus eventBus,
                     McrMetrics metrics) {
        this.sessionManager = sessionManager;
        this.strategyRegistry = strategyRegistry;
        this.executor = executor;
        this.router = router;
        this.classifier = classifier;
        this.refinementLoop = refinementLoop;
        this.refinementProperties = refinementProperties;
        this.deduction = deduction;
        this.deductionProperties = deductionProperties;
        this.reasoner = reasoner;
        this.generativeBackend = generativeBackend;
        this.invoker = invoker;
        this.prompts = prompts;
        this.llmProperties = llmProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public SessionContext createSession(String sessionId) {
        SessionContext session = sessionManager.create(sessionId);
        eventBus.publish(McrEvent.of("session.created", session.id(), null, Map.of()));
        return session;
    }

    /**
     * Classifies the text and dispatches to {@link #assertText} or {@link #query}.
     */
    public McrOutcome handle(String sessionId, String text, RequestOptions options) {
        InputClass inputClass = classifier.classify(text);
        return inputClass == InputClass.QUERY
                ? query(sessionId, text, options)
                : assertText(sessionId, text, options);
    }

    public AssertOutcome assertText(String sessionId, String text) {
        return assertText(sessionId, text, RequestOptions.defaults());
    }

    public AssertOutcome assertText(String sessionId, String text, RequestOptions options) {
        MdcContext.setRequest(sessionId, InputClass.ASSERT.value());
        long start = System.currentTimeMillis();
        try {
            SessionContext session = sessionManager.get(sessionId);
            StrategyGraph graph = selectStrategy(text, InputClass.ASSERT, options);
            MdcContext.setStrategy(graph.getId());
            log.info("Asserting via {}: {}", graph.getId(), text);

            RefinementResult refined = runRefined(graph, session, text, "naturalLanguageText");
            Artifact artifact = refined.requireConverged();

            List<String> before = session.facts();
            List<String> added = clausesOf(artifact).stream()
                    .map(SessionManager::normalize)
                    .filter(fact -> !fact.isEmpty() && !before.contains(fact))
                    .distinct()
                    .toList();
            sessionManager.addFacts(sessionId, added);

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordRequest(InputClass.ASSERT.value(), "success");
            eventBus.publish(McrEvent.of("assert.completed", sessionId, graph.getId(), Map.of(
                    "addedFacts", List.copyOf(added),
                    "iterations", refined.iterations())));
            log.info("Assertion added {} fact(s) in {}ms", added.size(), elapsed);
            return new AssertOutcome(sessionId, graph.getId(), added, refined.iterations(), refined.history(), elapsed);
        } catch (McrException e) {
            metrics.recordRequest(InputClass.ASSERT.value(), "error");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public QueryOutcome query(String sessionId, String question) {
        return query(sessionId, question, RequestOptions.defaults());
    }

    public QueryOutcome query(String sessionId, String question, RequestOptions options) {
        MdcContext.setRequest(sessionId, InputClass.QUERY.value());
        long start = System.currentTimeMillis();
        try {
            SessionContext session = sessionManager.get(sessionId);
            StrategyGraph graph = selectStrategy(question, InputClass.QUERY, options);
            MdcContext.setStrategy(graph.getId());
            log.info("Querying via {}: {}", graph.getId(), question);

            RefinementResult refined = runRefined(graph, session, question, "naturalLanguageQuestion");
            Artifact artifact = refined.requireConverged();

            String knowledgeBase = sessionManager.knowledgeBase(sessionId);
            String formalQuery;
            List<ScoredProof> proofs;
            if (artifact.type() == ArtifactType.QUERY_RESULT) {
                formalQuery = artifact.metadata().getOrDefault("query", "");
                proofs = certain(formalQuery, artifact.contentAs(ReasonerResult.class));
            } else if (artifact.type() == ArtifactType.FORMAL_QUERY) {
                String translated = artifact.asText();
                formalQuery = translated;
                proofs = deductionProperties.isGuided()
                        ? deduction.deduceGuided(question, knowledgeBase, deductionProperties.getThreshold(), translated)
                        : certain(translated, invoker.reasoner(() -> reasoner.query(knowledgeBase, translated)));
            } else {
                throw new InvalidOutputShapeException("Query strategy " + graph.getId()
                        + " produced " + artifact.type() + "; expected FORMAL_QUERY or QUERY_RESULT");
            }

            String answer = answer(question, proofs,
                    options == null ? RequestOptions.DEFAULT_STYLE : options.style());
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordRequest(InputClass.QUERY.value(), "success");
            eventBus.publish(McrEvent.of("query.completed", sessionId, graph.getId(), Map.of(
                    "query", formalQuery,
                    "proofs", proofs.size(),
                    "iterations", refined.iterations())));
            log.info("Query {} answered with {} proof(s) in {}ms", formalQuery, proofs.size(), elapsed);
            return new QueryOutcome(sessionId, graph.getId(), formalQuery, proofs, answer,
                    refined.iterations(), refined.history(), elapsed);
        } catch (McrException e) {
            metrics.recordRequest(InputClass.QUERY.value(), "error");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Explicit override, then the router's recommendation when it matches the
     * request class, then the configured default.
     */
    StrategyGraph selectStrategy(String text, InputClass inputClass, RequestOptions options) {
        if (options != null && options.strategyId() != null && !options.strategyId().isBlank()) {
            return strategyRegistry.get(options.strategyId());
        }
        String hash = router.route(text, llmProperties.modelId());
        if (hash != null) {
            Optional<StrategyGraph> routed = strategyRegistry.findByHash(hash);
            if (routed.isPresent() && routed.get().getInputType() == inputClass) {
                log.info("Router selected strategy {}", routed.get().getId());
                return routed.get();
            }
            log.warn("Router recommended hash {} which is not a loaded {} strategy; using default",
                    hash, inputClass.value());
        }
        return strategyRegistry.defaultFor(inputClass);
    }

    private RefinementResult runRefined(StrategyGraph graph, SessionContext session, String text, String inputName) {
        int maxIterations = refinementProperties.isEnabled() ? refinementProperties.getMaxIterations() : 1;
        long start = System.currentTimeMillis();
        RefinementResult refined;
        try {
            refined = refinementLoop.refine(
                    (input, ctx) -> executor.execute(graph, initialContext(ctx, inputName, input)),
                    text, session, maxIterations);
        } catch (McrException e) {
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordStrategyRun(graph.getId(), "error", elapsed);
            record(graph, session, false, elapsed);
            eventBus.publish(McrEvent.of("refinement.failed", session.id(), graph.getId(),
                    Map.of("error", String.valueOf(e.getMessage()))));
            throw e;
        }
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordStrategyRun(graph.getId(), refined.converged() ? "converged" : "not_converged", elapsed);
        record(graph, session, refined.converged(), elapsed);
        if (!refined.converged()) {
            eventBus.publish(McrEvent.of("refinement.failed", session.id(), graph.getId(), Map.of(
                    "iterations", refined.iterations(),
                    "errors", refined.history().stream().map(a -> a.error()).collect(Collectors.toList()))));
        }
        return refined;
    }

    private Map<String, Artifact> initialContext(SessionContext session, String inputName, String text) {
        Map<String, Artifact> context = new LinkedHashMap<>();
        context.put(inputName, Artifact.text(text));
        context.put("sessionId", Artifact.text(session.id()));
        context.put("existingFacts", Artifact.text(session.knowledgeBase()));
        context.put("ontologyRules", Artifact.text(sessionManager.ontologyRules()));
        context.put("lexiconSummary", Artifact.text(sessionManager.lexiconSummary(session.id())));
        return context;
    }

    private void record(StrategyGraph graph, SessionContext session, boolean valid, long elapsed) {
        try {
            Map<String, Object> runMetrics = new LinkedHashMap<>();
            runMetrics.put("prologStructureMatch", valid);
            router.recordPerformance(new PerformanceRecord(
                    strategyRegistry.hashOf(graph.getId()),
                    session.id(),
                    graph.getInputType() == null ? InputClass.ASSERT : graph.getInputType(),
                    runMetrics,
                    elapsed,
                    null,
                    llmProperties.modelId(),
                    null));
        } catch (McrException e) {
            log.warn("Could not record performance of {}: {}", graph.getId(), e.getMessage());
        }
    }

    private static List<String> clausesOf(Artifact artifact) {
        if (artifact.type() == ArtifactType.FORMAL_KB) {
            return artifact.clauses();
        }
        if (artifact.type() == ArtifactType.FORMAL_CLAUSE) {
            return List.of(artifact.asText());
        }
        throw new InvalidOutputShapeException("Assert strategy produced " + artifact.type()
                + "; expected FORMAL_KB or FORMAL_CLAUSE");
    }

    private static List<ScoredProof> certain(String query, ReasonerResult result) {
        List<ScoredProof> proofs = new ArrayList<>();
        for (String answer : result.results()) {
            proofs.add(new ScoredProof(query, answer, 1.0));
        }
        return proofs;
    }

    private String answer(String question, List<ScoredProof> proofs, String style) {
        String results = proofs.isEmpty()
                ? "No results"
                : proofs.stream().map(ScoredProof::proof).collect(Collectors.joining("\n"));
        PromptTemplate template = prompts.get("LOGIC_TO_NL_ANSWER");
        Map<String, String> vars = Map.of(
                "style", style,
                "naturalLanguageQuestion", question,
                "prologResults", results);
        return invoker.generative(() ->
                generativeBackend.generate(template.renderSystem(vars), template.renderUser(vars))).trim();
    }
}
