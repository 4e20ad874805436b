package com.tariffwise.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands command-line arguments to picocli and keeps its exit code for Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TariffwiseCommand tariffwiseCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TariffwiseCommand tariffwiseCommand, IFactory factory) {
        this.tariffwiseCommand = tariffwiseCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve mode: the embedded web server owns the process
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(tariffwiseCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
