package com.keystone.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Keystone.
 */
@Command(
        name = "keystone",
        mixinStandardHelpOptions = true,
        version = "Keystone 0.1.0",
        description = "Governance orchestration core: risk-tiered pipeline, policy store, provenance and audit",
        subcommands = {
                SubmitCommand.class,
                StatusCommand.class,
                TasksCommand.class,
                ResolveCommand.class,
                CancelCommand.class,
                ProposalsCommand.class,
                TokenCommand.class,
                AuditCommand.class,
                PolicyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KeystoneCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
