package com.mcr.dispatch.api;

import com.mcr.core.engine.AssertOutcome;
import com.mcr.core.engine.McrEngine;
import com.mcr.core.engine.McrOutcome;
import com.mcr.core.engine.QueryOutcome;
import com.mcr.core.engine.RequestOptions;
import com.mcr.core.session.SessionContext;
import com.mcr.core.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for sessions and the natural language requests made against them.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final McrEngine engine;
    private final SessionManager sessionManager;

    public SessionController(McrEngine engine, SessionManager sessionManager) {
        this.engine = engine;
        this.sessionManager = sessionManager;
    }

    /**
     * POST /api/v1/sessions: Create a session, optionally with a caller-chosen id.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> create(@RequestBody(required = false) SessionRequest request) {
        SessionContext session = engine.createSession(request == null ? null : request.sessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    @GetMapping
    public List<String> list() {
        return List.copyOf(sessionManager.list());
    }

    @GetMapping("/{sessionId}")
    public SessionResponse get(@PathVariable String sessionId) {
        return SessionResponse.from(sessionManager.get(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@PathVariable String sessionId) {
        sessionManager.delete(sessionId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/sessions/{id}/assert: Translate a statement and add it to the session.
     */
    @PostMapping("/{sessionId}/assert")
    public AssertOutcome assertText(@PathVariable String sessionId, @RequestBody TextRequest request) {
        requireText(request);
        log.debug("Assert request for session {}", sessionId);
        return engine.assertText(sessionId, request.text(), options(request));
    }

    /**
     * POST /api/v1/sessions/{id}/query: Answer a question from the session's knowledge.
     */
    @PostMapping("/{sessionId}/query")
    public QueryOutcome query(@PathVariable String sessionId, @RequestBody TextRequest request) {
        requireText(request);
        log.debug("Query request for session {}", sessionId);
        return engine.query(sessionId, request.text(), options(request));
    }

    /**
     * POST /api/v1/sessions/{id}/messages: Classify the text and assert or query accordingly.
     */
    @PostMapping("/{sessionId}/messages")
    public McrOutcome message(@PathVariable String sessionId, @RequestBody TextRequest request) {
        requireText(request);
        return engine.handle(sessionId, request.text(), options(request));
    }

    @PostMapping("/{sessionId}/facts")
    public SessionResponse addFacts(@PathVariable String sessionId, @RequestBody FactsRequest request) {
        if (request == null || request.facts() == null) {
            throw new IllegalArgumentException("facts are required");
        }
        return SessionResponse.from(sessionManager.addFacts(sessionId, request.facts()));
    }

    @GetMapping("/{sessionId}/knowledge-base")
    public Map<String, String> knowledgeBase(@PathVariable String sessionId) {
        return Map.of(
                "session_id", sessionId,
                "knowledge_base", sessionManager.knowledgeBase(sessionId));
    }

    @PutMapping("/{sessionId}/knowledge-base")
    public SessionResponse replaceKnowledgeBase(@PathVariable String sessionId,
                                                @RequestBody KnowledgeBaseRequest request) {
        if (request == null || request.knowledgeBase() == null) {
            throw new IllegalArgumentException("knowledge_base is required");
        }
        return SessionResponse.from(sessionManager.setKnowledgeBase(sessionId, request.knowledgeBase()));
    }

    private static void requireText(TextRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
    }

    private static RequestOptions options(TextRequest request) {
        return new RequestOptions(request.strategyId(), request.style());
    }
}
