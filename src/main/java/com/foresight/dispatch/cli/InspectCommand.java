package com.foresight.dispatch.cli;

import com.foresight.core.persistence.AnalysisRepository;
import com.foresight.core.persistence.RecommendationNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: foresight inspect &lt;id&gt;
 * <p>
 * Shows an analysis with its recommendations, or a single recommendation
 * when {@code --action} is given.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true,
        description = "Show an analysis or a single recommendation")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Analysis ID, or recommendation ID with --action")
    private String id;

    @Option(names = {"--action"}, description = "Treat the id as a recommendation id")
    private boolean action;

    private final AnalysisRepository repository;

    public InspectCommand(AnalysisRepository repository) {
        this.repository = repository;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (action) {
            try {
                ConsoleOutput.recommendation(repository.getActionById(id));
            } catch (RecommendationNotFoundException e) {
                ConsoleOutput.error(e.getMessage());
            }
            return;
        }

        var report = repository.getById(id);
        if (report.isEmpty()) {
            ConsoleOutput.error("Analysis not found: " + id);
            return;
        }
        ConsoleOutput.analysis(report.get().analysis());
        ConsoleOutput.recommendations(report.get().recommendations());
    }
}
