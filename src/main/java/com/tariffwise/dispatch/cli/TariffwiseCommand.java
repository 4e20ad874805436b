package com.tariffwise.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to: classify, health, serve.
 */
@Command(
        name = "tariffwise",
        mixinStandardHelpOptions = true,
        version = "Tariffwise 0.1.0",
        description = "Tariff classification with tool-calling models and validation gates",
        subcommands = {
                ClassifyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TariffwiseCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
