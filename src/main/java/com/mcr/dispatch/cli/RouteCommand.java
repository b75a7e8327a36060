package com.mcr.dispatch.cli;

import com.mcr.core.llm.LlmProperties;
import com.mcr.core.router.InputClass;
import com.mcr.core.router.InputClassifier;
import com.mcr.core.router.StrategyRouter;
import com.mcr.core.router.StrategyScore;
import com.mcr.core.strategy.StrategyGraph;
import com.mcr.core.strategy.StrategyRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Locale;

/**
 * CLI command: mcr route "&lt;text&gt;" [--model id]
 * <p>
 * Shows which strategy the router would pick for a text, with the ranking behind it.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Show the routing decision for a text")
@Component
public class RouteCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language statement or question")
    private String text;

    @Option(names = {"--model", "-m"}, description = "Model id to route for (default: the configured model)")
    private String modelId;

    private final StrategyRouter router;
    private final InputClassifier classifier;
    private final StrategyRegistry registry;
    private final LlmProperties llmProperties;

    public RouteCommand(StrategyRouter router, InputClassifier classifier,
                        StrategyRegistry registry, LlmProperties llmProperties) {
        this.router = router;
        this.classifier = classifier;
        this.registry = registry;
        this.llmProperties = llmProperties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        String model = modelId != null ? modelId : llmProperties.modelId();
        InputClass inputClass = classifier.classify(text);
        ConsoleOutput.info("Input class: " + inputClass.value() + " | Model: " + model);

        String hash = router.route(text, model);
        if (hash == null) {
            StrategyGraph fallback = registry.defaultFor(inputClass);
            ConsoleOutput.info("No recommendation; default strategy " + fallback.getId() + " would run");
            return;
        }
        String id = registry.findByHash(hash).map(StrategyGraph::getId).orElse("(unknown strategy)");
        ConsoleOutput.success("Recommended: " + id + " [" + hash + "]");

        System.out.println();
        for (StrategyScore score : router.scores(inputClass, model)) {
            String name = registry.findByHash(score.strategyHash()).map(StrategyGraph::getId).orElse(score.strategyHash());
            System.out.println(String.format(Locale.ROOT, "  %-22s mean %8.2f  successes %d/%d",
                    name, score.meanScore(), score.successCount(), score.samples()));
        }
    }
}
