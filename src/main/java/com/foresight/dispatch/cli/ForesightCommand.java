package com.foresight.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Foresight.
 */
@Command(
        name = "foresight",
        mixinStandardHelpOptions = true,
        version = "Foresight 0.1.0",
        description = "Autonomous analysis and recommendation pipeline",
        subcommands = {
                ServeCommand.class,
                AnalyzeCommand.class,
                HistoryCommand.class,
                InspectCommand.class,
                DecideCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForesightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
