package com.tenantoptions.cli.command;

import com.tenantoptions.model.Option;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.store.OptionCatalog;
import com.tenantoptions.store.OptionManager;
import com.tenantoptions.store.OptionQuery;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Lists the active options of every option model.
 *
 * <pre>
 * Model: tasks.TaskPriority
 *   Options:
 *     - Critical
 *     - Blocker (Tenant: 7)
 * </pre>
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(name = "list-options", mixinStandardHelpOptions = true, description = "List active options per model")
public class ListOptionsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    private final OptionCatalog catalog;

    public ListOptionsCommand(OptionCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<OptionModel> models = catalog.registry().optionModels();
        if (models.isEmpty()) {
            out.println("No options found in the project.");
            return 0;
        }
        for (OptionModel model : models) {
            OptionManager manager = catalog.requireOptionManager(model.label().toString());
            out.println("Model: " + model.label());
            out.println("  Options:");
            for (Option option : manager.find(OptionQuery.all().active())) {
                if (option.tenantId() != null) {
                    out.printf("    - %s (Tenant: %d)%n", option.name(), option.tenantId());
                } else {
                    out.println("    - " + option.name());
                }
            }
            out.println();
        }
        return 0;
    }
}
