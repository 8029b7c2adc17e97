package com.tenantoptions.cli.command;

import com.tenantoptions.model.CatalogModel;
import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;
import com.tenantoptions.store.DatabaseVendorResolver;
import com.tenantoptions.store.SchemaDdl;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Prints the CREATE TABLE statements of the registered option and selection tables. */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(
        name = "schema-sql",
        mixinStandardHelpOptions = true,
        description = "Print the DDL of the option and selection tables")
public class SchemaSqlCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--model", description = "Only print the tables of this model (app.Model)")
    String model;

    @Option(names = "--db-vendor-override", description = "Generate SQL for this vendor (sqlite, postgresql, mysql, oracle)")
    String vendorOverride;

    private final ModelRegistry registry;
    private final DatabaseVendorResolver vendorResolver;

    public SchemaSqlCommand(ModelRegistry registry, DatabaseVendorResolver vendorResolver) {
        this.registry = registry;
        this.vendorResolver = vendorResolver;
    }

    @Override
    public Integer call() {
        DatabaseVendor vendor = vendorResolver.resolve(vendorOverride);
        List<String> statements = model == null ? SchemaDdl.forRegistry(registry, vendor) : forModel(vendor);
        PrintWriter out = spec.commandLine().getOut();
        statements.forEach(statement -> out.println(statement + ";"));
        return 0;
    }

    private List<String> forModel(DatabaseVendor vendor) {
        CatalogModel found = registry.lookup(model)
                .orElseThrow(() -> new IllegalArgumentException("Unknown model: " + model));
        if (found instanceof OptionModel option) {
            return SchemaDdl.forOptionModel(option, vendor);
        }
        SelectionModel selection = (SelectionModel) found;
        String optionTable = registry.optionModelFor(selection).map(OptionModel::table).orElse(null);
        return SchemaDdl.forSelectionModel(selection, optionTable, vendor);
    }
}
