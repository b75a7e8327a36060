package com.mcr.core.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned, immutable snapshot of one session's knowledge.
 * <p>
 * Facts keep insertion order; so do embeddings, which makes nearest-fact
 * lookups deterministic. Every mutation produces a new snapshot with
 * {@code version + 1}.
 *
 * @param facts      validated clauses, each ending with a period
 * @param lexicon    {@code predicate/arity} indicators derived from the facts
 * @param embeddings fact text to embedding vector, for facts that could be embedded
 */
public record SessionContext(
    String id,
    long version,
    Instant createdAt,
    List<String> facts,
    Set<String> lexicon,
    Map<String, float[]> embeddings
) {

    public SessionContext {
        facts = List.copyOf(facts);
        lexicon = Collections.unmodifiableSet(new LinkedHashSet<>(lexicon));
        embeddings = Collections.unmodifiableMap(new LinkedHashMap<>(embeddings));
    }

    public static SessionContext empty(String id) {
        return new SessionContext(id, 0, Instant.now(), List.of(), Set.of(), Map.of());
    }

    public SessionContext withAddedFacts(List<String> added, Set<String> newLexicon, Map<String, float[]> newEmbeddings) {
        var allFacts = new ArrayList<>(facts);
        allFacts.addAll(added);
        var allEmbeddings = new LinkedHashMap<>(embeddings);
        allEmbeddings.putAll(newEmbeddings);
        return new SessionContext(id, version + 1, createdAt, allFacts, newLexicon, allEmbeddings);
    }

    public SessionContext withFacts(List<String> replacement, Set<String> newLexicon, Map<String, float[]> newEmbeddings) {
        return new SessionContext(id, version + 1, createdAt, replacement, newLexicon, newEmbeddings);
    }

    public String knowledgeBase() {
        return String.join("\n", facts);
    }

    public boolean hasEmbeddings() {
        return !embeddings.isEmpty();
    }
}
