package com.foresight.dispatch.cli;

import com.foresight.core.host.AgentProperties;
import com.foresight.core.model.Analysis;
import com.foresight.core.persistence.AnalysisRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: foresight history
 * <p>
 * Lists recent analyses: Analysis ID | Created | Duration | Overview (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent analyses")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final AnalysisRepository repository;
    private final AgentProperties agent;

    public HistoryCommand(AnalysisRepository repository, AgentProperties agent) {
        this.repository = repository;
        this.agent = agent;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Analysis> analyses = repository.listByAgent(agent.getId(), Math.max(1, Math.min(limit, 100)));
        if (analyses.isEmpty()) {
            ConsoleOutput.info("No analyses found.");
            return;
        }

        ConsoleOutput.info("Analyses for " + agent.getId() + " (" + analyses.size() + "):");
        System.out.println();
        System.out.printf("  %-36s  %-20s %-8s %s%n", "ANALYSIS ID", "CREATED", "TOOK", "OVERVIEW");
        System.out.println("  " + "-".repeat(100));

        for (Analysis a : analyses) {
            System.out.printf("  %-36s  %-20s %-8s %s%n", a.id(),
                    a.createdAt().toString().substring(0, Math.min(19, a.createdAt().toString().length())),
                    ConsoleOutput.formatDuration(a.executionTimeMs()),
                    truncate(a.sections().overview(), 40));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
