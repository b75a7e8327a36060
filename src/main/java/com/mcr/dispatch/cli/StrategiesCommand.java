package com.mcr.dispatch.cli;

import com.mcr.core.router.InputClass;
import com.mcr.core.strategy.StrategyGraph;
import com.mcr.core.strategy.StrategyRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: mcr strategies
 * <p>
 * Lists the loaded strategies with their input class, output type and hash.
 */
@Command(name = "strategies", mixinStandardHelpOptions = true, description = "List available strategies")
@Component
public class StrategiesCommand implements Runnable {

    private final StrategyRegistry registry;

    public StrategiesCommand(StrategyRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var strategies = registry.all();
        if (strategies.isEmpty()) {
            ConsoleOutput.info("No strategies loaded.");
            return;
        }
        System.out.printf("%-22s %-7s %-14s %s%n", "ID", "INPUT", "OUTPUT", "HASH");
        for (StrategyGraph graph : strategies) {
            String hash = registry.hashOf(graph.getId());
            System.out.printf("%-22s %-7s %-14s %s%n",
                    graph.getId(),
                    graph.getInputType() == null ? "-" : graph.getInputType().value(),
                    graph.outputType().name(),
                    hash.substring(0, Math.min(12, hash.length())));
        }
        System.out.println();
        ConsoleOutput.info(strategies.size() + " strategies; defaults: assert="
                + registry.defaultFor(InputClass.ASSERT).getId()
                + ", query=" + registry.defaultFor(InputClass.QUERY).getId());
    }
}
