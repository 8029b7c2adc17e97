package com.tenantoptions.cli.command;

import com.tenantoptions.cli.Consoles;
import com.tenantoptions.cli.Verbosity;
import com.tenantoptions.database.trigger.GenerationResult;
import com.tenantoptions.database.trigger.TriggerMigrationGenerator;
import com.tenantoptions.store.DatabaseVendorResolver;
import java.util.concurrent.Callable;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Writes one migration per selection model installing the tenant consistency trigger. */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(
        name = "make-triggers",
        mixinStandardHelpOptions = true,
        description = "Generate migrations creating the tenant consistency triggers")
public class MakeTriggersCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    TriggerOptions options;

    @Option(names = "--force", description = "Generate even when the trigger already exists")
    boolean force;

    private final TriggerMigrationGenerator generator;
    private final DatabaseVendorResolver vendorResolver;

    public MakeTriggersCommand(TriggerMigrationGenerator generator, DatabaseVendorResolver vendorResolver) {
        this.generator = generator;
        this.vendorResolver = vendorResolver;
    }

    @Override
    public Integer call() {
        Verbosity.apply(options.verbose);
        var commandOptions = options.toBuilder(vendorResolver.resolve(options.vendorOverride))
                .force(force)
                .build();
        GenerationResult result = generator.generate(commandOptions, Consoles.forCommand(spec));
        if (result.migrations().isEmpty() && result.skipped().isEmpty()) {
            spec.commandLine().getOut().println("No selection models to process.");
        }
        return 0;
    }
}
