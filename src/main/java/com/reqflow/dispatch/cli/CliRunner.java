package com.reqflow.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli once the context is up and keeps the resulting
 * exit code for {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * {@code reqflow serve} is not executed here: that invocation is owned by the embedded web
 * server, which outlives this runner.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final ReqflowCommand root;
    private final IFactory factory;
    private volatile int exitCode;

    public CliRunner(ReqflowCommand root, IFactory factory) {
        this.root = root;
        this.factory = factory;
    }

    /**
     * True when the first non-option argument is {@code serve}, so a file named
     * {@code serve} passed to {@code validate} still runs a validation.
     */
    public static boolean servesHttp(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (servesHttp(args)) {
            log.debug("Leaving 'serve' to the web server lifecycle");
            return;
        }
        exitCode = new CommandLine(root, factory).execute(args);
        log.debug("CLI finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
