package com.mcr.core.reasoner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HornClauseReasonerTest {

    private static final String FAMILY = """
            father(tom, bob).
            father(bob, ann).
            mother(liz, bob).
            parent(X, Y) :- father(X, Y).
            parent(X, Y) :- mother(X, Y).
            grandparent(X, Z) :- parent(X, Y), parent(Y, Z).
            """;

    private ReasonerProperties properties;
    private HornClauseReasoner reasoner;

    @BeforeEach
    void setUp() {
        properties = new ReasonerProperties();
        reasoner = new HornClauseReasoner(properties);
    }

    @Nested
    @DisplayName("query")
    class Query {

        @Test
        @DisplayName("renders variable bindings per solution in clause order")
        void bindings() {
            ReasonerResult result = reasoner.query(FAMILY, "parent(P, bob).");

            assertEquals(List.of("P = tom", "P = liz"), result.results());
            assertEquals("parent(tom,bob)\nparent(liz,bob)", result.proof());
        }

        @Test
        @DisplayName("ground query that holds yields true")
        void groundTrue() {
            ReasonerResult result = reasoner.query(FAMILY, "grandparent(tom, ann).");

            assertEquals(List.of("true"), result.results());
        }

        @Test
        @DisplayName("query without solutions yields an empty result and no proof")
        void noSolutions() {
            ReasonerResult result = reasoner.query(FAMILY, "grandparent(ann, tom).");

            assertFalse(result.hasResults());
            assertNull(result.proof());
        }

        @Test
        @DisplayName("calls to unknown predicates fail quietly")
        void unknownPredicate() {
            assertTrue(reasoner.query(FAMILY, "likes(tom, X).").results().isEmpty());
        }

        @Test
        @DisplayName("tolerates a leading ?- and a missing full stop")
        void lenientQuerySyntax() {
            assertEquals(List.of("X = bob"), reasoner.query(FAMILY, "?- father(tom, X)").results());
        }

        @Test
        @DisplayName("negation as failure and inequality")
        void negation() {
            String kb = FAMILY + "childless(X) :- father(_, X), \\+ father(X, _).\n";

            assertEquals(List.of("X = ann"), reasoner.query(kb, "childless(X).").results());
            assertEquals(List.of("true"), reasoner.query(kb, "tom \\= bob.").results());
        }

        @Test
        @DisplayName("numeric comparison")
        void arithmetic() {
            String kb = "age(tom, 70).\nage(bob, 40).\nsenior(X) :- age(X, A), A >= 65.\n";

            assertEquals(List.of("X = tom"), reasoner.query(kb, "senior(X).").results());
        }

        @Test
        @DisplayName("stops after the configured number of solutions")
        void solutionLimit() {
            properties.setMaxSolutions(1);

            assertEquals(1, reasoner.query(FAMILY, "parent(P, C).").results().size());
        }

        @Test
        @DisplayName("left recursion is cut off by the depth limit instead of overflowing")
        void depthLimit() {
            properties.setMaxDepth(20);
            String kb = "path(X, Y) :- path(X, Z), edge(Z, Y).\npath(a, b).\n";

            assertDoesNotThrow(() -> reasoner.query(kb, "path(a, c)."));
        }

        @Test
        @DisplayName("malformed query raises a syntax error")
        void malformedQuery() {
            assertThrows(ClauseSyntaxException.class, () -> reasoner.query(FAMILY, "parent(X, ."));
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("accepts well-formed facts and rules")
        void valid() {
            assertTrue(reasoner.validate(FAMILY).valid());
        }

        @Test
        @DisplayName("rejects a clause without a full stop")
        void missingFullStop() {
            ValidationResult result = reasoner.validate("father(tom, bob)");

            assertFalse(result.valid());
            assertNotNull(result.error());
        }

        @Test
        @DisplayName("rejects redefinition of built-ins")
        void builtinRedefinition() {
            ValidationResult result = reasoner.validate("true :- father(tom, bob).");

            assertFalse(result.valid());
            assertTrue(result.error().contains("true/0"));
        }

        @Test
        @DisplayName("rejects directives")
        void directives() {
            assertFalse(reasoner.validate(":- dynamic(foo/1).").valid());
        }

        @Test
        @DisplayName("validateQuery rejects a bare variable")
        void bareVariableQuery() {
            assertFalse(reasoner.validateQuery("X.").valid());
            assertTrue(reasoner.validateQuery("parent(X, bob).").valid());
        }
    }
}
