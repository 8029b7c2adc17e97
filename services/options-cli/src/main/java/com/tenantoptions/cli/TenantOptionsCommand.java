package com.tenantoptions.cli;

import com.tenantoptions.cli.command.ListOptionsCommand;
import com.tenantoptions.cli.command.MakeTriggersCommand;
import com.tenantoptions.cli.command.MigrateCommand;
import com.tenantoptions.cli.command.RemoveTriggersCommand;
import com.tenantoptions.cli.command.SchemaSqlCommand;
import com.tenantoptions.cli.command.SyncOptionsCommand;
import com.tenantoptions.cli.command.ValidateOptionsCommand;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command. Without a subcommand it prints the usage help.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code list-options} - List active options per model</li>
 *   <li>{@code sync-options} - Bring default options in line with the configuration</li>
 *   <li>{@code validate-options} - Audit the model configuration</li>
 *   <li>{@code make-triggers} - Generate trigger migrations</li>
 *   <li>{@code remove-triggers} - Generate trigger removal migrations</li>
 *   <li>{@code schema-sql} - Print table DDL</li>
 *   <li>{@code migrate} - Apply migrations with Flyway</li>
 * </ul>
 */
@Component
@Command(
        name = "tenant-options",
        mixinStandardHelpOptions = true,
        version = "tenant-options 0.1.0",
        description = "Operator commands for the multi-tenant options catalog",
        subcommands = {
            ListOptionsCommand.class,
            SyncOptionsCommand.class,
            ValidateOptionsCommand.class,
            MakeTriggersCommand.class,
            RemoveTriggersCommand.class,
            SchemaSqlCommand.class,
            MigrateCommand.class
        })
public class TenantOptionsCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
