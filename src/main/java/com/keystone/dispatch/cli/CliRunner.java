package com.keystone.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final KeystoneCommand keystoneCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(KeystoneCommand keystoneCommand, IFactory factory) {
        this.keystoneCommand = keystoneCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server keeps the JVM alive; picocli's
        // execute() would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(keystoneCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
