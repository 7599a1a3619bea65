package com.reqflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Reqflow.
 * Routes to subcommands: validate, serve.
 */
@Command(
        name = "reqflow",
        mixinStandardHelpOptions = true,
        version = "Reqflow 0.1.0",
        description = "Requirements mining, validation and clarification workflow",
        subcommands = {
                ValidateCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ReqflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
