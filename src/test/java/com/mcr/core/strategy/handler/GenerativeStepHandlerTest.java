package com.mcr.core.strategy.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.backend.BackendProperties;
import com.mcr.core.error.InvalidOutputShapeException;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.llm.LlmParseException;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.strategy.Step;
import com.mcr.core.strategy.StepAction;
import com.mcr.core.strategy.StepInput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class GenerativeStepHandlerTest {

    private GenerativeBackend backend;
    private BackendInvoker invoker;
    private GenerativeStepHandler handler;

    @BeforeEach
    void setUp() {
        backend = mock(GenerativeBackend.class);
        var props = new BackendProperties();
        props.setGenerativeTimeout(Duration.ZERO);
        invoker = new BackendInvoker(props);
        handler = new GenerativeStepHandler(backend, new PromptTemplates(), invoker, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        invoker.destroy();
    }

    private static StepInput input() {
        return new StepInput("direct-s1-assert",
                Map.of("naturalLanguageText", Artifact.text("Tom is Bob's father.")),
                Map.of("lexiconSummary", Artifact.text("father/2")));
    }

    private static Step step(String template, ArtifactType target) {
        return new Step("translate", null, List.of("naturalLanguageText"), new StepAction.Generative(template, target));
    }

    @Test
    @DisplayName("fills the template from the run's artifacts")
    void fillsTemplate() {
        when(backend.generate(anyString(), anyString())).thenReturn("father(tom, bob).");

        handler.handle(step("NL_TO_LOGIC", ArtifactType.FORMAL_KB), (StepAction.Generative) step("NL_TO_LOGIC",
                ArtifactType.FORMAL_KB).action(), input());

        verify(backend).generate(anyString(), contains("Tom is Bob's father."));
        verify(backend).generate(anyString(), contains("father/2"));
    }

    @Test
    @DisplayName("FORMAL_KB replies are split into clauses")
    void formalKb() {
        when(backend.generate(anyString(), anyString())).thenReturn("```prolog\nfather(tom, bob).\nmale(tom).\n```");
        Step step = step("NL_TO_LOGIC", ArtifactType.FORMAL_KB);

        Artifact out = handler.handle(step, (StepAction.Generative) step.action(), input());

        assertEquals(ArtifactType.FORMAL_KB, out.type());
        assertEquals(List.of("father(tom, bob).", "male(tom)."), out.clauses());
        assertEquals("NL_TO_LOGIC", out.metadata().get("template"));
    }

    @Test
    @DisplayName("FORMAL_QUERY replies are normalised")
    void formalQuery() {
        when(backend.generate(anyString(), anyString())).thenReturn("?- father(X, bob)..");
        Step step = step("NL_TO_QUERY", ArtifactType.FORMAL_QUERY);

        Artifact out = handler.handle(step, (StepAction.Generative) step.action(), input());

        assertEquals("father(X, bob).", out.asText());
    }

    @Test
    @DisplayName("SIR_JSON replies are parsed, and unparsable ones raise LlmParseException")
    void sirJson() {
        Step step = step("NL_TO_SIR_ASSERT", ArtifactType.SIR_JSON);
        when(backend.generate(anyString(), anyString()))
                .thenReturn("{\"statementType\": \"fact\"}")
                .thenReturn("I cannot do that");

        Artifact out = handler.handle(step, (StepAction.Generative) step.action(), input());
        assertEquals("fact", out.contentAs(JsonNode.class).get("statementType").asText());

        assertThrows(LlmParseException.class,
                () -> handler.handle(step, (StepAction.Generative) step.action(), input()));
    }

    @Test
    @DisplayName("a generative step cannot produce a query result")
    void unsupportedTarget() {
        when(backend.generate(anyString(), anyString())).thenReturn("anything");
        Step step = step("NL_TO_QUERY", ArtifactType.QUERY_RESULT);

        assertThrows(InvalidOutputShapeException.class,
                () -> handler.handle(step, (StepAction.Generative) step.action(), input()));
    }
}
