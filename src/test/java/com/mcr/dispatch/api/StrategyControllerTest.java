package com.mcr.dispatch.api;

import com.mcr.core.error.StrategyNotFoundException;
import com.mcr.core.llm.LlmProperties;
import com.mcr.core.performance.PerformanceRecord;
import com.mcr.core.router.InputClass;
import com.mcr.core.router.InputClassifier;
import com.mcr.core.router.StrategyRouter;
import com.mcr.core.router.StrategyScore;
import com.mcr.core.strategy.StrategyGraph;
import com.mcr.core.strategy.StrategyRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StrategyController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class StrategyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StrategyRegistry registry;

    @MockitoBean
    private StrategyRouter router;

    @MockitoBean
    private InputClassifier classifier;

    @MockitoBean
    private LlmProperties llmProperties;

    @Test
    @DisplayName("POST /route reports the recommended strategy for the configured model")
    void route() throws Exception {
        StrategyGraph graph = mock(StrategyGraph.class);
        when(graph.getId()).thenReturn("sir-r1-query");
        when(llmProperties.modelId()).thenReturn("openai");
        when(classifier.classify("Who?")).thenReturn(InputClass.QUERY);
        when(router.route("Who?", "openai")).thenReturn("abc123");
        when(registry.findByHash("abc123")).thenReturn(Optional.of(graph));

        mockMvc.perform(post("/api/v1/strategies/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Who?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.input_class").value("query"))
                .andExpect(jsonPath("$.model_id").value("openai"))
                .andExpect(jsonPath("$.strategy_hash").value("abc123"))
                .andExpect(jsonPath("$.strategy_id").value("sir-r1-query"));
    }

    @Test
    @DisplayName("POST /route without history returns null strategy fields")
    void routeWithoutHistory() throws Exception {
        when(classifier.classify(anyString())).thenReturn(InputClass.ASSERT);
        when(registry.findByHash(null)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/strategies/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Ann likes tea.\", \"model_id\": \"ollama:llama3\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model_id").value("ollama:llama3"))
                .andExpect(jsonPath("$.strategy_hash").doesNotExist());
        verify(router).route("Ann likes tea.", "ollama:llama3");
    }

    @Test
    @DisplayName("GET /performance returns ranked scores; an unknown input type is a 400")
    void performance() throws Exception {
        when(router.scores(InputClass.QUERY, null))
                .thenReturn(List.of(new StrategyScore("abc123", 150.0, 3, 120.0, null, 4)));

        mockMvc.perform(get("/api/v1/strategies/performance").param("input_type", "query"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].strategyHash").value("abc123"))
                .andExpect(jsonPath("$[0].successCount").value(3));

        mockMvc.perform(get("/api/v1/strategies/performance").param("input_type", "command"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/v1/strategies/performance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("POST /performance resolves the strategy hash from its id and returns 201")
    void recordPerformance() throws Exception {
        when(registry.hashOf("direct-s1-query")).thenReturn("abc123");

        mockMvc.perform(post("/api/v1/strategies/performance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"strategy_id": "direct-s1-query", "input_type": "query",
                                 "metrics": {"exactMatchAnswer": true}, "latency_ms": 250}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.strategy_hash").value("abc123"));

        var captor = ArgumentCaptor.forClass(PerformanceRecord.class);
        verify(router).recordPerformance(captor.capture());
        assertEquals("abc123", captor.getValue().strategyHash());
        assertEquals(InputClass.QUERY, captor.getValue().inputType());
        assertEquals(250L, captor.getValue().latencyMs());
    }

    @Test
    @DisplayName("POST /performance without a strategy returns 400")
    void recordPerformanceWithoutStrategy() throws Exception {
        mockMvc.perform(post("/api/v1/strategies/performance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input_type\": \"assert\"}"))
                .andExpect(status().isBadRequest());
        verify(router, never()).recordPerformance(any());
    }

    @Test
    @DisplayName("GET /strategies/{id} returns 404 for an unknown strategy")
    void unknownStrategy() throws Exception {
        when(registry.get(eq("missing"))).thenThrow(new StrategyNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/strategies/missing"))
                .andExpect(status().isNotFound());
    }
}
