package com.mcr.core.strategy.handler;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.CritiqueResult;
import com.mcr.core.backend.BackendInvoker;
import com.mcr.core.backend.BackendProperties;
import com.mcr.core.embedding.EmbeddingBackend;
import com.mcr.core.error.BackendException;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.llm.GenerativeBackend;
import com.mcr.core.prompt.PromptTemplates;
import com.mcr.core.strategy.Step;
import com.mcr.core.strategy.StepAction;
import com.mcr.core.strategy.StepInput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class CompareStepHandlerTest {

    private GenerativeBackend generative;
    private EmbeddingBackend embedding;
    private BackendInvoker invoker;

    @BeforeEach
    void setUp() {
        generative = mock(GenerativeBackend.class);
        embedding = mock(EmbeddingBackend.class);
        invoker = new BackendInvoker(new BackendProperties());
    }

    @AfterEach
    void tearDown() {
        invoker.destroy();
    }

    private CritiqueResult compare(CompareStepHandler handler, StepAction.Compare action, String... texts) {
        Map<String, Artifact> named = new LinkedHashMap<>();
        for (int i = 0; i < texts.length; i++) {
            named.put("in" + i, Artifact.text(texts[i]));
        }
        Step step = new Step("check", null, List.copyOf(named.keySet()), action);
        return handler.handle(step, action, new StepInput("s", named, named)).contentAs(CritiqueResult.class);
    }

    private CompareStepHandler handler(EmbeddingBackend embeddingBackend) {
        return new CompareStepHandler(new PromptTemplates(), invoker, generative, embeddingBackend);
    }

    @Test
    @DisplayName("exact comparison ignores whitespace differences")
    void exact() {
        var action = new StepAction.Compare("exact", 0.8);

        assertTrue(compare(handler(null), action, "a(b).  c(d).", " a(b). c(d).").pass());
        CritiqueResult differ = compare(handler(null), action, "a(b).", "a(c).");
        assertFalse(differ.pass());
        assertEquals(0.0, differ.similarity());
    }

    @Test
    @DisplayName("embedding comparison applies the threshold to cosine similarity")
    void embeddingThreshold() {
        when(embedding.encode("cat")).thenReturn(new float[]{1, 0});
        when(embedding.encode("kitten")).thenReturn(new float[]{0.6f, 0.8f});
        when(embedding.similarity(any(), any())).thenCallRealMethod();

        CritiqueResult loose = compare(handler(embedding), new StepAction.Compare("embedding", 0.5), "cat", "kitten");
        CritiqueResult strict = compare(handler(embedding), new StepAction.Compare("embedding", 0.9), "cat", "kitten");

        assertEquals(0.6, loose.similarity(), 1e-6);
        assertTrue(loose.pass());
        assertFalse(strict.pass());
    }

    @Test
    @DisplayName("embedding comparison without a backend is a backend error")
    void embeddingMissing() {
        assertThrows(BackendException.class,
                () -> compare(handler(null), new StepAction.Compare("embedding", 0.8), "a", "b"));
    }

    @Test
    @DisplayName("llm comparison reads the verdict")
    void llm() {
        when(generative.generate(anyString(), contains("Text A"))).thenReturn("SIMILAR").thenReturn("DIFFERENT");

        assertTrue(compare(handler(null), new StepAction.Compare("llm", 0.8), "x", "y").pass());
        assertFalse(compare(handler(null), new StepAction.Compare("llm", 0.8), "x", "y").pass());
    }

    @Test
    @DisplayName("unknown methods and wrong arity are definition errors")
    void definitionErrors() {
        assertThrows(StrategyDefinitionException.class,
                () -> compare(handler(null), new StepAction.Compare("fuzzy", 0.8), "a", "b"));
        assertThrows(StrategyDefinitionException.class,
                () -> compare(handler(null), new StepAction.Compare("exact", 0.8), "a"));
    }
}
