package com.mcr.core.strategy.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.llm.LlmParseException;
import com.mcr.core.strategy.StepInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransformFunctionsTest {

    private static StepInput input(Artifact artifact) {
        return new StepInput("test", Map.of("in", artifact), Map.of());
    }

    private static StepInput text(String text) {
        return input(Artifact.text(text));
    }

    @Nested
    @DisplayName("extract_clauses")
    class ExtractClauses {

        @Test
        @DisplayName("produces a knowledge base")
        void clauses() {
            Artifact out = new ExtractClausesTransform().apply(text("a.\nb."), Map.of());

            assertEquals(ArtifactType.FORMAL_KB, out.type());
            assertEquals(List.of("a.", "b."), out.clauses());
        }

        @Test
        @DisplayName("no clauses is a validation failure")
        void empty() {
            assertThrows(ValidationFailedException.class,
                    () -> new ExtractClausesTransform().apply(text("% nothing"), Map.of()));
        }
    }

    @Nested
    @DisplayName("extract_query")
    class ExtractQuery {

        @Test
        @DisplayName("normalizes the generated query")
        void query() {
            Artifact out = new ExtractQueryTransform().apply(text("?- likes(X, tea)"), Map.of());

            assertEquals(ArtifactType.FORMAL_QUERY, out.type());
            assertEquals("likes(X, tea).", out.asText());
        }

        @Test
        @DisplayName("rules are not accepted as queries")
        void rule() {
            assertThrows(ValidationFailedException.class,
                    () -> new ExtractQueryTransform().apply(text("a(X) :- b(X)."), Map.of()));
        }
    }

    @Nested
    @DisplayName("split_lines")
    class SplitLines {

        @Test
        @DisplayName("splits on line breaks by default, dropping blanks and comments")
        void lines() {
            Artifact out = new SplitLinesTransform().apply(text("a.\n\n% c\n b. "), Map.of());

            assertEquals(List.of("a.", "b."), out.clauses());
        }

        @Test
        @DisplayName("honours a literal delimiter and a limit")
        void delimiterAndLimit() {
            Artifact out = new SplitLinesTransform().apply(text("a.|b.|c."), Map.of("delimiter", "|", "limit", "2"));

            assertEquals(List.of("a.", "b."), out.clauses());
        }

        @Test
        @DisplayName("a non-numeric limit is a configuration error")
        void badLimit() {
            assertThrows(StrategyDefinitionException.class,
                    () -> new SplitLinesTransform().apply(text("a."), Map.of("limit", "many")));
        }
    }

    @Nested
    @DisplayName("parse_json")
    class ParseJson {

        private final ParseJsonTransform transform = new ParseJsonTransform(new ObjectMapper());

        @Test
        @DisplayName("parses JSON embedded in prose")
        void embedded() {
            Artifact out = transform.apply(text("Answer: {\"statementType\": \"fact\"} thanks"), Map.of());

            assertEquals(ArtifactType.SIR_JSON, out.type());
            assertEquals("fact", out.contentAs(JsonNode.class)
                    .get("statementType").asText());
        }

        @Test
        @DisplayName("passes SIR_JSON input through")
        void passThrough() {
            Artifact sir = Artifact.of(ArtifactType.SIR_JSON, JsonNodeFactory.instance.objectNode());

            assertSame(sir, transform.apply(input(sir), Map.of()));
        }

        @Test
        @DisplayName("missing or malformed JSON raises LlmParseException")
        void failures() {
            assertThrows(LlmParseException.class, () -> transform.apply(text("no json"), Map.of()));
            assertThrows(LlmParseException.class, () -> transform.apply(text("{\"a\": }"), Map.of()));
        }
    }

    @Test
    @DisplayName("sir_to_clauses requires SIR_JSON content")
    void sirToClausesRequiresJson() {
        assertThrows(RuntimeException.class, () -> new SirToClausesTransform().apply(text("{}"), Map.of()));
    }

    @Nested
    @DisplayName("TransformRegistry")
    class Registry {

        @Test
        @DisplayName("looks transforms up by name")
        void lookup() {
            var registry = new TransformRegistry(List.of(new ExtractClausesTransform(), new SplitLinesTransform()));

            assertTrue(registry.contains("split_lines"));
            assertEquals(List.of("extract_clauses", "split_lines"), List.copyOf(registry.names()));
            assertThrows(StrategyDefinitionException.class, () -> registry.get("rot13"));
        }

        @Test
        @DisplayName("duplicate names are rejected")
        void duplicates() {
            assertThrows(StrategyDefinitionException.class, () -> new TransformRegistry(
                    List.of(new SplitLinesTransform(), new SplitLinesTransform())));
        }
    }
}
