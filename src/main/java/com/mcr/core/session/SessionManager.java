package com.mcr.core.session;

import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.McrException;
import com.mcr.core.error.SessionNotFoundException;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.TermParser;
import com.mcr.core.reasoner.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Session lifecycle and knowledge mutation. Every fact is validated by the
 * reasoner before it is stored; the lexicon is recomputed from the full fact
 * list and new facts are embedded when an embedding backend is configured.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore store;
    private final ReasonerBackend reasoner;
    private final BackendInvoker invoker;
    private final LexiconExtractor lexiconExtractor;
    private final OntologyService ontologyService;
    private final EmbeddingBackend embeddingBackend;

    public SessionManager(SessionStore store,
                          ReasonerBackend reasoner,
                          BackendInvoker invoker,
                          LexiconExtractor lexiconExtractor,
                          OntologyService ontologyService,
                          @Autowired(required = false) EmbeddingBackend embeddingBackend) {
        this.store = store;
        this.reasoner = reasoner;
        this.invoker = invoker;
        this.lexiconExtractor = lexiconExtractor;
        this.ontologyService = ontologyService;
        this.embeddingBackend = embeddingBackend;
    }

    public SessionContext create() {
        return create(null);
    }

    public SessionContext create(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        SessionContext created = store.create(SessionContext.empty(id));
        log.info("Session {} ready (version {})", id, created.version());
        return created;
    }

    public SessionContext get(String sessionId) {
        return store.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Collection<String> list() {
        return store.ids();
    }

    public boolean delete(String sessionId) {
        boolean removed = store.delete(sessionId);
        if (!removed) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Session {} deleted", sessionId);
        return true;
    }

    /**
     * Validates and appends clauses. Clauses already present are not added twice.
     *
     * @throws ValidationFailedException when the reasoner rejects any clause
     */
    public SessionContext addFacts(String sessionId, List<String> clauses) {
        SessionContext current = get(sessionId);
        List<String> normalized = new ArrayList<>();
        for (String clause : clauses) {
            String fact = normalize(clause);
            if (!fact.isEmpty() && !current.facts().contains(fact) && !normalized.contains(fact)) {
                normalized.add(fact);
            }
        }
        if (normalized.isEmpty()) {
            return current;
        }
        validate(String.join("\n", normalized));
        Map<String, float[]> vectors = embed(normalized);

        SessionContext updated = store.update(sessionId, ctx -> {
            var all = new ArrayList<>(ctx.facts());
            all.addAll(normalized);
            return ctx.withAddedFacts(normalized, lexiconExtractor.extract(all), vectors);
        });
        log.info("Session {} now holds {} fact(s) (version {})", sessionId, updated.facts().size(), updated.version());
        return updated;
    }

    /**
     * Replaces all facts of a session with the clauses of {@code knowledgeBase}.
     */
    public SessionContext setKnowledgeBase(String sessionId, String knowledgeBase) {
        get(sessionId);
        validate(knowledgeBase);
        List<String> facts = TermParser.parseClauses(knowledgeBase).stream()
                .map(term -> term + ".")
                .toList();
        Map<String, float[]> vectors = embed(facts);
        return store.update(sessionId, ctx -> ctx.withFacts(facts, lexiconExtractor.extract(facts), vectors));
    }

    /**
     * Session facts followed by the global ontology rules.
     */
    public String knowledgeBase(String sessionId) {
        SessionContext ctx = get(sessionId);
        String ontology = ontologyService.rulesText();
        if (ontology.isBlank()) {
            return ctx.knowledgeBase();
        }
        return ctx.knowledgeBase().isBlank() ? ontology : ctx.knowledgeBase() + "\n" + ontology;
    }

    public String lexiconSummary(String sessionId) {
        return lexiconExtractor.summarize(get(sessionId).lexicon());
    }

    public String ontologyRules() {
        return ontologyService.rulesText();
    }

    private void validate(String clauses) {
        ValidationResult result = invoker.reasoner(() -> reasoner.validate(clauses));
        if (!result.valid()) {
            throw new ValidationFailedException(result.error());
        }
    }

    private Map<String, float[]> embed(List<String> facts) {
        Map<String, float[]> vectors = new LinkedHashMap<>();
        if (embeddingBackend == null) {
            return vectors;
        }
        for (String fact : facts) {
            try {
                vectors.put(fact, invoker.embedding(() -> embeddingBackend.encode(fact)));
            } catch (McrException e) {
                log.warn("Could not embed fact '{}': {}", fact, e.getMessage());
            }
        }
        return vectors;
    }

    /**
     * Trims a clause and ensures it ends with a period; blank input yields the empty string.
     */
    public static String normalize(String clause) {
        String fact = clause == null ? "" : clause.strip();
        if (fact.isEmpty()) {
            return fact;
        }
        return fact.endsWith(".") ? fact : fact + ".";
    }
}
