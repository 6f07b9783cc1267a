package com.socmind.dispatch.cli;

import com.socmind.core.engine.OrchestrationEngine;
import com.socmind.provider.ProviderProperties;
import com.socmind.scenario.DemoScenario;
import com.socmind.scenario.DemoScenarios;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: socmind scenario [name...]
 * <p>
 * Runs the built-in demo scenarios and checks that each ends in its expected status.
 * Expectations hold for the simulated providers only.
 */
@Command(name = "scenario", mixinStandardHelpOptions = true, description = "Run built-in demo scenarios")
@Component
public class ScenarioCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Scenario names; all scenarios when omitted")
    List<String> names = List.of();

    @Option(names = {"--list", "-l"}, description = "List scenarios and exit")
    boolean list;

    private final OrchestrationEngine engine;
    private final ProviderProperties providerProperties;

    public ScenarioCommand(OrchestrationEngine engine, ProviderProperties providerProperties) {
        this.engine = engine;
        this.providerProperties = providerProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (list) {
            for (var scenario : DemoScenarios.all()) {
                System.out.printf("  %-20s %s%n", scenario.name(), scenario.description());
            }
            return 0;
        }
        if (!"simulated".equalsIgnoreCase(providerProperties.getMode())) {
            ConsoleOutput.warn("Providers are in '" + providerProperties.getMode()
                    + "' mode; expected outcomes assume simulated providers");
        }

        List<DemoScenario> selected;
        if (names.isEmpty()) {
            selected = DemoScenarios.all();
        } else {
            selected = new ArrayList<>();
            for (var name : names) {
                var scenario = DemoScenarios.find(name);
                if (scenario.isEmpty()) {
                    ConsoleOutput.error("Unknown scenario: " + name);
                    return 2;
                }
                selected.add(scenario.get());
            }
        }

        int mismatches = 0;
        for (var scenario : selected) {
            ConsoleOutput.info(scenario.name() + ": " + scenario.description());
            var state = engine.runTask(scenario.submission());
            ConsoleOutput.result(state);
            if (state.status() == scenario.expectedStatus()) {
                ConsoleOutput.success(scenario.name() + " ended " + state.status());
            } else {
                ConsoleOutput.error(scenario.name() + " ended " + state.status()
                        + ", expected " + scenario.expectedStatus());
                mismatches++;
            }
            System.out.println();
        }
        return mismatches == 0 ? 0 : 1;
    }
}
