package com.foresight.dispatch.cli;

import com.foresight.core.decision.DecisionProcessor;
import com.foresight.core.model.Decision;
import com.foresight.core.model.Verdict;
import com.foresight.core.persistence.AnalysisRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: foresight decide &lt;action-id&gt; accept|reject
 * <p>
 * Records a decision on a pending recommendation. An accepted recommendation runs in
 * the background; the command waits for that run and prints the outcome, so the
 * recommendation is never left {@code executing} when the process exits.
 */
@Command(name = "decide", mixinStandardHelpOptions = true, description = "Accept or reject a recommendation")
@Component
public class DecideCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Recommendation ID")
    private String actionId;

    @Parameters(index = "1", description = "accept or reject")
    private String decision;

    @Option(names = {"--timeout"}, description = "Seconds to wait for an accepted action to finish",
            defaultValue = "120")
    private long timeoutSeconds;

    private final DecisionProcessor decisionProcessor;
    private final AnalysisRepository repository;

    public DecideCommand(DecisionProcessor decisionProcessor, AnalysisRepository repository) {
        this.decisionProcessor = decisionProcessor;
        this.repository = repository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var verdict = Verdict.parse(decision);
        if (verdict.isEmpty()) {
            ConsoleOutput.error("Decision must be 'accept' or 'reject', got: " + decision);
            return 2;
        }

        var result = decisionProcessor.process(List.of(new Decision(actionId, verdict.get())));
        if (!result.rejected().isEmpty()) {
            ConsoleOutput.success("Rejected " + actionId);
            return 0;
        }
        if (result.accepted().isEmpty()) {
            ConsoleOutput.error("Action " + actionId + " was not decided (unknown or no longer pending)");
            return 1;
        }

        ConsoleOutput.success("Accepted " + actionId + ", executing " + result.accepted().get(0).capabilityType());
        var running = decisionProcessor.inFlight(actionId);
        if (running.isPresent()) {
            try {
                running.get().get(timeoutSeconds, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                ConsoleOutput.warn("Still executing after " + timeoutSeconds + "s; waiting for it before exit");
                return 1;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 1;
            } catch (ExecutionException e) {
                ConsoleOutput.error("Execution error: " + e.getCause().getMessage());
            }
        }
        ConsoleOutput.recommendation(repository.getActionById(actionId));
        return 0;
    }
}
