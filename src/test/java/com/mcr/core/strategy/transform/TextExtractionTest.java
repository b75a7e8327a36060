package com.mcr.core.strategy.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextExtractionTest {

    @Nested
    @DisplayName("stripCodeFence")
    class StripCodeFence {

        @Test
        @DisplayName("returns the body of a fenced block")
        void fenced() {
            assertEquals("a(b).", TextExtraction.stripCodeFence("Sure:\n```prolog\na(b).\n```\nDone."));
        }

        @Test
        @DisplayName("handles an unterminated fence")
        void unterminated() {
            assertEquals("a(b).", TextExtraction.stripCodeFence("```prolog\na(b)."));
        }

        @Test
        @DisplayName("plain text is trimmed; null becomes empty")
        void plain() {
            assertEquals("a(b).", TextExtraction.stripCodeFence("  a(b). \n"));
            assertEquals("", TextExtraction.stripCodeFence(null));
        }
    }

    @Nested
    @DisplayName("normalizeQuery")
    class NormalizeQuery {

        @Test
        @DisplayName("drops ?- and collapses trailing periods")
        void prefixAndPeriods() {
            assertEquals("parent(X, bob).", TextExtraction.normalizeQuery("?- parent(X, bob)..."));
        }

        @Test
        @DisplayName("adds the missing period and keeps only the first line")
        void firstLine() {
            assertEquals("a(X).", TextExtraction.normalizeQuery("a(X)\nb(Y)."));
        }

        @Test
        @DisplayName("strips list numbering")
        void numbering() {
            assertEquals("likes(X, tea).", TextExtraction.normalizeQuery("1. likes(X, tea)."));
            assertEquals("likes(X, tea).", TextExtraction.normalizeQuery("- likes(X, tea)"));
        }

        @Test
        @DisplayName("empty input stays empty")
        void empty() {
            assertEquals("", TextExtraction.normalizeQuery("```\n```"));
        }
    }

    @Test
    @DisplayName("extractClauses joins multi-line clauses and skips comments")
    void extractClauses() {
        List<String> clauses = TextExtraction.extractClauses("""
                ```prolog
                % family facts
                father(tom, bob).

                grandparent(X, Z) :-
                    parent(X, Y),
                    parent(Y, Z).
                dangling(x)
                ```
                """);

        assertEquals(List.of(
                "father(tom, bob).",
                "grandparent(X, Z) :- parent(X, Y), parent(Y, Z).",
                "dangling(x)"), clauses);
    }

    @Test
    @DisplayName("extractJson finds the outermost object or array")
    void extractJson() {
        assertEquals("{\"a\": [1, 2]}", TextExtraction.extractJson("Result: {\"a\": [1, 2]} ok"));
        assertEquals("[{\"a\": 1}]", TextExtraction.extractJson("```json\n[{\"a\": 1}]\n```"));
        assertNull(TextExtraction.extractJson("no json here"));
    }
}
