package com.tenantoptions.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Builds the picocli {@link CommandLine} over Spring-managed commands.
 *
 * <p>Failures of a subcommand print {@code ERROR: <message>} and exit with status 1; the stack
 * trace is logged at DEBUG.
 */
@Component
public class TenantOptionsCli {

    private static final Logger log = LoggerFactory.getLogger(TenantOptionsCli.class);

    private final TenantOptionsCommand root;
    private final IFactory factory;

    public TenantOptionsCli(TenantOptionsCommand root, IFactory factory) {
        this.root = root;
        this.factory = factory;
    }

    public CommandLine commandLine() {
        return configure(new CommandLine(root, factory));
    }

    /** Installs the error handler on a command line. */
    public static CommandLine configure(CommandLine commandLine) {
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.debug("Command {} failed", cmd.getCommandName(), ex);
            cmd.getErr().println("ERROR: " + ex.getMessage());
            cmd.getErr().flush();
            return 1;
        });
        return commandLine;
    }

    public int execute(String... args) {
        return commandLine().execute(args);
    }
}
