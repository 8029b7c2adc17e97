package com.tenantoptions.cli.command;

import com.tenantoptions.model.DefaultOption;
import com.tenantoptions.model.Option;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.OptionType;
import com.tenantoptions.model.TenantOptionsException;
import com.tenantoptions.store.OptionCatalog;
import com.tenantoptions.store.OptionManager;
import com.tenantoptions.store.OptionQuery;
import com.tenantoptions.store.SyncAction;
import com.tenantoptions.store.SyncReport;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Brings the default options of every option model in line with the configuration and reports
 * what changed.
 *
 * <p>A model that fails to sync is logged and skipped; the remaining models are still synced and
 * the command exits with status 1.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(
        name = "sync-options",
        mixinStandardHelpOptions = true,
        description = "Synchronize default options with the configured models")
public class SyncOptionsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncOptionsCommand.class);

    @Spec
    CommandSpec spec;

    private final OptionCatalog catalog;

    public SyncOptionsCommand(OptionCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<OptionModel> models = catalog.registry().optionModels();
        if (models.isEmpty()) {
            out.println("No default options found in the project.");
            return 0;
        }
        int exitCode = 0;
        for (OptionModel model : models) {
            try {
                OptionManager manager = catalog.requireOptionManager(model.label().toString());
                SyncReport report = manager.syncDefaultOptions();
                print(out, model, manager, report);
            } catch (TenantOptionsException | DataAccessException | IllegalArgumentException e) {
                log.error("Error updating options for {}: {}", model.label(), e.getMessage());
                spec.commandLine().getErr().println("ERROR: Could not sync " + model.label() + ": " + e.getMessage());
                exitCode = 1;
            }
        }
        return exitCode;
    }

    // ── Report Sections ──

    private void print(PrintWriter out, OptionModel model, OptionManager manager, SyncReport report) {
        out.println();
        out.println("Model: " + model.label());
        printImportedOrVerified(out, model, report);
        printCustomOptions(out, manager);
        printNewlyDeleted(out, report);
        printPreExistingDeleted(out, manager, report);
    }

    private void printImportedOrVerified(PrintWriter out, OptionModel model, SyncReport report) {
        List<String> kept = report.actions().entrySet().stream()
                .filter(entry -> entry.getValue() != SyncAction.DELETED)
                .map(Map.Entry::getKey)
                .toList();
        if (kept.isEmpty()) {
            out.println("  No options imported or verified");
            return;
        }
        out.println("  Imported or Verified Options:");
        for (String name : kept) {
            String type = model.defaultOptions().stream()
                    .filter(option -> option.name().equals(name))
                    .map(DefaultOption::optionType)
                    .findFirst()
                    .map(OptionType::label)
                    .orElse("Unknown");
            out.printf("    - '%s', Type: %s%n", name, type);
        }
        out.printf("    %d options imported or verified%n", kept.size());
    }

    private void printCustomOptions(PrintWriter out, OptionManager manager) {
        List<Option> custom = manager.find(OptionQuery.all().active().customOptions());
        if (custom.isEmpty()) {
            out.println("  No Custom Options");
            return;
        }
        out.println("  All Custom Options:");
        custom.forEach(option -> out.printf("    - '%s', Tenant: %d%n", option.name(), option.tenantId()));
        out.printf("    %d Custom Options%n", custom.size());
    }

    private void printNewlyDeleted(PrintWriter out, SyncReport report) {
        List<String> deleted = report.namesWith(SyncAction.DELETED);
        if (deleted.isEmpty()) {
            out.println("  No Newly Deleted Options");
            return;
        }
        out.println("  Newly Deleted Options:");
        deleted.forEach(name -> out.printf("    - '%s'%n", name));
        out.printf("    %d Newly Deleted Options%n", deleted.size());
    }

    private void printPreExistingDeleted(PrintWriter out, OptionManager manager, SyncReport report) {
        List<Option> deleted = manager.find(OptionQuery.all().deleted().excludingNames(report.actions().keySet()));
        if (deleted.isEmpty()) {
            out.println("  No Pre-existing Deleted Options");
            return;
        }
        out.println("  All Pre-existing Deleted Options:");
        deleted.forEach(option -> out.printf("    - '%s', Type: %s%n", option.name(), option.optionType().label()));
        out.printf("    %d Pre-existing Deleted Options%n", deleted.size());
    }
}
