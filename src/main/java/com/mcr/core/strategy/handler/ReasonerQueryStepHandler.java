package com.mcr.core.strategy.handler;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ReasonerResult;
import com.mcr.core.session.SessionManager;
import com.mcr.core.strategy.Step;
import com.mcr.core.strategy.StepAction;
import com.mcr.core.strategy.StepHandler;
import com.mcr.core.strategy.StepInput;
import com.mcr.core.strategy.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs a formal query against a knowledge base artifact, the knowledge base of
 * a session, or both combined. Without an explicit {@code queryInput} the first
 * {@code FORMAL_QUERY} input is used.
 */
@Component
public class ReasonerQueryStepHandler implements StepHandler<StepAction.ReasonerQuery> {

    private static final Logger log = LoggerFactory.getLogger(ReasonerQueryStepHandler.class);

    private final ReasonerBackend reasoner;
    private final SessionManager sessionManager;
    private final BackendInvoker invoker;

    public ReasonerQueryStepHandler(ReasonerBackend reasoner, SessionManager sessionManager, BackendInvoker invoker) {
        this.reasoner = reasoner;
        this.sessionManager = sessionManager;
        this.invoker = invoker;
    }

    @Override
    public StepKind kind() {
        return StepKind.REASONER_QUERY;
    }

    @Override
    public Class<StepAction.ReasonerQuery> actionType() {
        return StepAction.ReasonerQuery.class;
    }

    @Override
    public Artifact handle(Step step, StepAction.ReasonerQuery action, StepInput input) {
        String query = queryArtifact(step, action, input).asText();
        String knowledgeBase = knowledgeBase(step, action, input);

        ReasonerResult result = invoker.reasoner(() -> reasoner.query(knowledgeBase, query));
        log.debug("Step {} query {} returned {} result(s)", step.id(), query, result.results().size());
        return Artifact.of(ArtifactType.QUERY_RESULT, result, Map.of("query", query, "step", step.id()));
    }

    private Artifact queryArtifact(Step step, StepAction.ReasonerQuery action, StepInput input) {
        if (action.queryInput() != null) {
            return input.require(action.queryInput());
        }
        return input.named().values().stream()
                .filter(a -> a.type() == ArtifactType.FORMAL_QUERY)
                .findFirst()
                .orElseThrow(() -> new StrategyDefinitionException("Reasoner step '" + step.id()
                        + "' of strategy " + input.strategyId() + " has no FORMAL_QUERY input"));
    }

    private String knowledgeBase(Step step, StepAction.ReasonerQuery action, StepInput input) {
        if (action.knowledgeBaseInput() == null && action.sessionInput() == null) {
            throw new StrategyDefinitionException("Reasoner step '" + step.id() + "' of strategy "
                    + input.strategyId() + " names neither a knowledge base nor a session input");
        }
        var kb = new StringBuilder();
        if (action.sessionInput() != null) {
            String sessionId = input.require(action.sessionInput()).asText().trim();
            kb.append(sessionManager.knowledgeBase(sessionId));
        }
        if (action.knowledgeBaseInput() != null) {
            String extra = input.require(action.knowledgeBaseInput()).asText();
            if (kb.length() > 0 && !extra.isBlank()) {
                kb.append('\n');
            }
            kb.append(extra);
        }
        return kb.toString();
    }
}
