package com.tenantoptions.cli.command;

import com.tenantoptions.cli.Consoles;
import com.tenantoptions.cli.Verbosity;
import com.tenantoptions.database.trigger.JdbcTriggerCatalog;
import com.tenantoptions.database.trigger.TriggerRemovalGenerator;
import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.store.DatabaseVendorResolver;
import com.tenantoptions.store.StoreContext;
import java.util.concurrent.Callable;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Writes one migration per app dropping the triggers earlier migrations installed. */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(
        name = "remove-triggers",
        mixinStandardHelpOptions = true,
        description = "Generate migrations removing the tenant consistency triggers")
public class RemoveTriggersCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    TriggerOptions options;

    @Option(names = "--verify", description = "Skip triggers that are not installed in the database")
    boolean verify;

    private final TriggerRemovalGenerator generator;
    private final DatabaseVendorResolver vendorResolver;
    private final StoreContext storeContext;

    public RemoveTriggersCommand(
            TriggerRemovalGenerator generator, DatabaseVendorResolver vendorResolver, StoreContext storeContext) {
        this.generator = generator;
        this.vendorResolver = vendorResolver;
        this.storeContext = storeContext;
    }

    @Override
    public Integer call() {
        Verbosity.apply(options.verbose);
        DatabaseVendor vendor = vendorResolver.resolve(options.vendorOverride);
        var commandOptions = options.toBuilder(vendor).verify(verify).build();
        var catalog = verify ? new JdbcTriggerCatalog(storeContext.jdbc(), vendor) : null;
        generator.generate(commandOptions, catalog, Consoles.forCommand(spec));
        return 0;
    }
}
