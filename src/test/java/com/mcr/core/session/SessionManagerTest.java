package com.mcr.core.session;

import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.backend.BackendProperties;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.SessionNotFoundException;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.reasoner.HornClauseReasoner;
import com.mcr.core.reasoner.ReasonerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private HornClauseReasoner reasoner;
    private BackendInvoker invoker;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        reasoner = new HornClauseReasoner(new ReasonerProperties());
        invoker = new BackendInvoker(new BackendProperties());
        manager = newManager(OntologyService.none(), null);
    }

    private SessionManager newManager(OntologyService ontology, EmbeddingBackend embedding) {
        return new SessionManager(new InMemorySessionStore(), reasoner, invoker,
                new LexiconExtractor(), ontology, embedding);
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("create assigns an id when none is given")
        void generatedId() {
            SessionContext session = manager.create();

            assertNotNull(session.id());
            assertEquals(0, session.version());
            assertTrue(session.facts().isEmpty());
        }

        @Test
        @DisplayName("create with an existing id returns the existing session")
        void createIsIdempotent() {
            manager.create("s1");
            manager.addFacts("s1", List.of("likes(ann, tea)."));

            SessionContext again = manager.create("s1");

            assertEquals(1, again.facts().size());
        }

        @Test
        @DisplayName("get of an unknown id raises SessionNotFoundException")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> manager.get("missing"));
        }

        @Test
        @DisplayName("delete removes the session; deleting twice fails")
        void delete() {
            manager.create("s1");

            assertTrue(manager.delete("s1"));
            assertFalse(manager.list().contains("s1"));
            assertThrows(SessionNotFoundException.class, () -> manager.delete("s1"));
        }
    }

    @Nested
    @DisplayName("addFacts")
    class AddFacts {

        @Test
        @DisplayName("normalizes, deduplicates and bumps the version")
        void normalizesAndDeduplicates() {
            manager.create("s1");

            SessionContext ctx = manager.addFacts("s1", List.of(" likes(ann, tea) ", "likes(ann, tea).", ""));

            assertEquals(List.of("likes(ann, tea)."), ctx.facts());
            assertEquals(1, ctx.version());
            assertTrue(ctx.lexicon().contains("likes/2"));
        }

        @Test
        @DisplayName("facts already in the session are not added again")
        void existingFactsSkipped() {
            manager.create("s1");
            manager.addFacts("s1", List.of("likes(ann, tea)."));

            SessionContext ctx = manager.addFacts("s1", List.of("likes(ann, tea).", "likes(bob, coffee)."));

            assertEquals(2, ctx.facts().size());
            assertEquals(2, ctx.version());
        }

        @Test
        @DisplayName("rejects invalid clauses and leaves the session unchanged")
        void invalidClause() {
            manager.create("s1");

            assertThrows(ValidationFailedException.class,
                    () -> manager.addFacts("s1", List.of("likes(ann, .")));
            assertEquals(0, manager.get("s1").version());
        }

        @Test
        @DisplayName("embeds new facts when an embedding backend is present")
        void embedsFacts() {
            EmbeddingBackend embedding = mock(EmbeddingBackend.class);
            when(embedding.encode(anyString())).thenReturn(new float[]{1f, 0f});
            SessionManager withEmbeddings = newManager(OntologyService.none(), embedding);
            withEmbeddings.create("s1");

            SessionContext ctx = withEmbeddings.addFacts("s1", List.of("likes(ann, tea)."));

            assertTrue(ctx.hasEmbeddings());
            assertArrayEquals(new float[]{1f, 0f}, ctx.embeddings().get("likes(ann, tea)."));
        }

        @Test
        @DisplayName("a failing embedding backend does not block the facts")
        void embeddingFailureTolerated() {
            EmbeddingBackend embedding = mock(EmbeddingBackend.class);
            when(embedding.encode(anyString())).thenThrow(new IllegalStateException("down"));
            SessionManager withEmbeddings = newManager(OntologyService.none(), embedding);
            withEmbeddings.create("s1");

            SessionContext ctx = withEmbeddings.addFacts("s1", List.of("likes(ann, tea)."));

            assertEquals(1, ctx.facts().size());
            assertFalse(ctx.hasEmbeddings());
        }
    }

    @Nested
    @DisplayName("knowledge base")
    class KnowledgeBase {

        @Test
        @DisplayName("setKnowledgeBase replaces every fact")
        void replaces() {
            manager.create("s1");
            manager.addFacts("s1", List.of("likes(ann, tea)."));

            SessionContext ctx = manager.setKnowledgeBase("s1", "father(tom, bob).\nfather(bob, ann).");

            assertEquals(List.of("father(tom,bob).", "father(bob,ann)."), ctx.facts());
            assertEquals(Set.of("father/2"), ctx.lexicon());
        }

        @Test
        @DisplayName("knowledgeBase appends the ontology rules to the session facts")
        void includesOntology() {
            SessionManager withOntology = newManager(
                    new OntologyService(List.of("parent(X, Y) :- father(X, Y).")), null);
            withOntology.create("s1");
            withOntology.addFacts("s1", List.of("father(tom, bob)."));

            assertEquals("father(tom, bob).\nparent(X, Y) :- father(X, Y).", withOntology.knowledgeBase("s1"));
        }

        @Test
        @DisplayName("lexicon summary of an empty session")
        void emptyLexicon() {
            manager.create("s1");

            assertEquals("No predicates defined yet.", manager.lexiconSummary("s1"));
        }
    }

    @Test
    @DisplayName("normalize appends the missing full stop")
    void normalize() {
        assertEquals("a(b).", SessionManager.normalize(" a(b) "));
        assertEquals("a(b).", SessionManager.normalize("a(b)."));
        assertEquals("", SessionManager.normalize("   "));
        assertEquals("", SessionManager.normalize(null));
    }
}
