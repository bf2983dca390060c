package com.healloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Healloop.
 * Routes to subcommands: proposals, show, apply, reject, health, serve.
 */
@Command(
        name = "healloop",
        mixinStandardHelpOptions = true,
        version = "Healloop 0.1.0",
        description = "Self-healing tool execution engine: review and apply enhancement proposals",
        subcommands = {
                ProposalsCommand.class,
                ShowCommand.class,
                ApplyCommand.class,
                RejectCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HealloopCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
