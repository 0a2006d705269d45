package com.foresight.dispatch.cli;

import com.foresight.core.engine.AnalysisEngine;
import com.foresight.core.host.AgentProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: foresight analyze
 * <p>
 * Runs one analysis in the foreground and prints the narrative and the
 * recommendations it produced.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Run an analysis now")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Option(names = {"--agent", "-a"}, description = "Agent id (defaults to foresight.agent.id)")
    private String agentId;

    private final AnalysisEngine analysisEngine;
    private final AgentProperties agent;

    public AnalyzeCommand(AnalysisEngine analysisEngine, AgentProperties agent) {
        this.analysisEngine = analysisEngine;
        this.agent = agent;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String effectiveAgent = agentId != null && !agentId.isBlank() ? agentId : agent.getId();
        ConsoleOutput.info("Running analysis for agent " + effectiveAgent + "...");

        try {
            var report = analysisEngine.runAnalysis(effectiveAgent);
            ConsoleOutput.analysis(report.analysis());
            ConsoleOutput.recommendations(report.recommendations());
            System.out.println();
            ConsoleOutput.success("Analysis " + report.analysis().id() + " saved");
            return 0;
        } catch (Exception e) {
            ConsoleOutput.error("Analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
