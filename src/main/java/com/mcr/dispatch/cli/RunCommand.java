package com.mcr.dispatch.cli;

import com.mcr.core.engine.AssertOutcome;
import com.mcr.core.engine.McrEngine;
import com.mcr.core.engine.McrOutcome;
import com.mcr.core.engine.QueryOutcome;
import com.mcr.core.engine.RequestOptions;
import com.mcr.core.error.McrException;
import com.mcr.core.error.RefinementExhaustedException;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.events.EventBus;
import com.mcr.core.session.SessionContext;
import com.mcr.core.session.SessionManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: mcr run [--kb file] [--strategy id] [--verbose] "&lt;input&gt;"...
 * <p>
 * Runs each input against one fresh session, in order. Statements extend the
 * session's knowledge, so later questions can be answered from earlier inputs.
 * Exits 1 if any input failed.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Assert statements and answer questions in one session")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Natural language statements or questions, processed in order")
    private List<String> inputs;

    @Option(names = {"--kb", "-k"}, description = "File with clauses to seed the session's knowledge base")
    private Path knowledgeBaseFile;

    @Option(names = {"--strategy", "-s"}, description = "Strategy id to use instead of routing")
    private String strategyId;

    @Option(names = {"--style"}, description = "Answer style", defaultValue = RequestOptions.DEFAULT_STYLE)
    private String style;

    @Option(names = {"--verbose", "-v"}, description = "Print request events as they happen")
    private boolean verbose;

    private final McrEngine engine;
    private final SessionManager sessionManager;
    private final EventBus eventBus;

    public RunCommand(McrEngine engine, SessionManager sessionManager, EventBus eventBus) {
        this.engine = engine;
        this.sessionManager = sessionManager;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SessionContext session = engine.createSession(null);
        EventBus.Subscription subscription = verbose
                ? eventBus.subscribe(session.id(), event -> ConsoleOutput.watchEvent(event.eventType(), event.payload()))
                : null;
        try {
            if (knowledgeBaseFile != null && !seed(session.id())) {
                return 1;
            }
            RequestOptions options = new RequestOptions(strategyId, style);
            int failures = 0;
            for (String input : inputs) {
                if (!runOne(session.id(), input, options)) {
                    failures++;
                }
            }
            System.out.println("──────────────────────────────────");
            SessionContext finalSession = sessionManager.get(session.id());
            ConsoleOutput.info("Session " + finalSession.id() + ": " + finalSession.facts().size()
                    + " fact(s), version " + finalSession.version());
            if (failures > 0) {
                ConsoleOutput.error(failures + " of " + inputs.size() + " input(s) failed");
                return 1;
            }
            return 0;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private boolean seed(String sessionId) {
        String text;
        try {
            text = Files.readString(knowledgeBaseFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read knowledge base " + knowledgeBaseFile + ": " + e.getMessage());
            return false;
        }
        try {
            SessionContext seeded = sessionManager.setKnowledgeBase(sessionId, text);
            ConsoleOutput.success("Loaded " + seeded.facts().size() + " clause(s) from " + knowledgeBaseFile);
            return true;
        } catch (McrException e) {
            ConsoleOutput.error("Invalid knowledge base " + knowledgeBaseFile + ": " + e.getMessage());
            return false;
        }
    }

    private boolean runOne(String sessionId, String input, RequestOptions options) {
        System.out.println();
        ConsoleOutput.info("> " + input);
        McrOutcome outcome;
        try {
            outcome = engine.handle(sessionId, input, options);
        } catch (ValidationFailedException e) {
            ConsoleOutput.error("[" + e.getErrorCode() + "] " + e.getMessage());
            ConsoleOutput.history(e.getHistory());
            return false;
        } catch (RefinementExhaustedException e) {
            ConsoleOutput.error("[" + e.getErrorCode() + "] " + e.getMessage());
            ConsoleOutput.history(e.getHistory());
            return false;
        } catch (McrException e) {
            ConsoleOutput.error("[" + e.getErrorCode() + "] " + e.getMessage());
            return false;
        }

        if (outcome instanceof AssertOutcome a) {
            ConsoleOutput.success("Asserted " + a.addedFacts().size() + " fact(s) via " + a.strategyId()
                    + " (" + a.iterations() + " iteration(s), " + ConsoleOutput.formatDuration(a.latencyMs()) + ")");
            a.addedFacts().forEach(ConsoleOutput::fact);
        } else if (outcome instanceof QueryOutcome q) {
            ConsoleOutput.success("Query " + q.query() + " via " + q.strategyId()
                    + " (" + q.iterations() + " iteration(s), " + ConsoleOutput.formatDuration(q.latencyMs()) + ")");
            q.proofs().forEach(ConsoleOutput::proof);
            System.out.println();
            System.out.println(q.answer());
        }
        if (verbose && !outcome.history().isEmpty()) {
            ConsoleOutput.history(outcome.history());
        }
        return true;
    }
}
