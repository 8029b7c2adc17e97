package com.tenantoptions.audit;

import com.tenantoptions.model.ConstraintNames;
import com.tenantoptions.model.DefaultOption;
import com.tenantoptions.model.ModelLabel;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;
import com.tenantoptions.model.TenantOptionsException;
import com.tenantoptions.store.OptionCatalog;
import com.tenantoptions.store.OptionManager;
import com.tenantoptions.store.OptionRepository;
import com.tenantoptions.store.SelectionManager;
import com.tenantoptions.store.SelectionQuery;
import com.tenantoptions.store.SelectionRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Checks every registered option and selection model for configuration mistakes.
 *
 * <h2>Checks</h2>
 *
 * <ul>
 *   <li>FATAL: no manager bound, a missing selection, option or tenant model reference, a default
 *       option declared with a type other than MANDATORY or OPTIONAL
 *   <li>WARNING: a manager other than the JDBC repositories, no default options, duplicate live
 *       default names, missing constraints, active selections of deleted options, no models at all
 * </ul>
 *
 * <p>Each finding stands alone; a storage failure while counting is reported as a warning for that
 * model and the audit carries on.
 */
public class ConfigurationAuditor {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationAuditor.class);

    private final OptionCatalog catalog;

    public ConfigurationAuditor(OptionCatalog catalog) {
        this.catalog = catalog;
    }

    public AuditReport audit() {
        ModelRegistry registry = catalog.registry();
        List<AuditFinding> findings = new ArrayList<>();

        List<OptionModel> optionModels = registry.optionModels();
        if (optionModels.isEmpty()) {
            findings.add(AuditFinding.warning(null,
                    "No option models registered. Declare them under tenant-options.models."));
        } else {
            findings.add(AuditFinding.note(null, "Found %d option model(s)".formatted(optionModels.size())));
        }
        optionModels.forEach(model -> auditOptionModel(model, findings));

        List<SelectionModel> selectionModels = registry.selectionModels();
        if (selectionModels.isEmpty()) {
            findings.add(AuditFinding.warning(null,
                    "No selection models registered. Declare them under tenant-options.models."));
        } else {
            findings.add(AuditFinding.note(null, "Found %d selection model(s)".formatted(selectionModels.size())));
        }
        selectionModels.forEach(model -> auditSelectionModel(model, registry, findings));

        var report = new AuditReport(findings);
        log.debug("Audit finished with {} error(s) and {} warning(s)", report.errors().size(), report.warnings().size());
        return report;
    }

    // ── Option models ──

    private void auditOptionModel(OptionModel model, List<AuditFinding> findings) {
        ModelLabel label = model.label();
        OptionManager manager = catalog.optionManager(label).orElse(null);
        if (manager == null) {
            findings.add(AuditFinding.fatal(label, "no option manager is bound"));
        } else if (!(manager instanceof OptionRepository)) {
            findings.add(AuditFinding.warning(label, "manager %s is not an OptionRepository; tenant filtering may not work as expected"
                    .formatted(manager.getClass().getSimpleName())));
        } else {
            findings.add(AuditFinding.note(label, "manager configured"));
        }

        if (model.selectionModel() == null) {
            findings.add(AuditFinding.fatal(label, "selection model not set"));
        } else {
            findings.add(AuditFinding.note(label, "selection model = " + model.selectionModel()));
        }
        checkTenantModel(label, model.tenantModel(), findings);

        List<DefaultOption> defaults = model.defaultOptions();
        if (defaults.isEmpty()) {
            findings.add(AuditFinding.warning(label,
                    "no default options defined; consider declaring mandatory or optional defaults"));
        } else {
            findings.add(AuditFinding.note(label, "%d default option(s) defined".formatted(defaults.size())));
            for (DefaultOption option : defaults) {
                if (!option.optionType().isDefaultType()) {
                    findings.add(AuditFinding.fatal(label,
                            "invalid option type for default option '%s'; must be MANDATORY or OPTIONAL, got %s"
                                    .formatted(option.name(), option.optionType())));
                }
            }
        }

        if (manager != null) {
            try {
                List<String> duplicates = manager.duplicateDefaultNames();
                if (!duplicates.isEmpty()) {
                    findings.add(AuditFinding.warning(label,
                            "duplicate default option names in the database: " + duplicates));
                }
            } catch (DataAccessException | TenantOptionsException e) {
                log.debug("Duplicate check failed for {}", label, e);
                findings.add(AuditFinding.warning(label,
                        "could not check for duplicate default options: " + e.getMessage()));
            }
        }

        checkConstraints(label, model.constraints(), ConstraintNames.expectedForOption(label), findings);
    }

    // ── Selection models ──

    private void auditSelectionModel(SelectionModel model, ModelRegistry registry, List<AuditFinding> findings) {
        ModelLabel label = model.label();
        SelectionManager manager = catalog.selectionManager(label).orElse(null);
        if (manager == null) {
            findings.add(AuditFinding.fatal(label, "no selection manager is bound"));
        } else if (!(manager instanceof SelectionRepository)) {
            findings.add(AuditFinding.warning(label, "manager %s is not a SelectionRepository; tenant filtering may not work as expected"
                    .formatted(manager.getClass().getSimpleName())));
        } else {
            findings.add(AuditFinding.note(label, "manager configured"));
        }

        if (model.optionModel() == null) {
            findings.add(AuditFinding.fatal(label, "option model not set"));
        } else {
            findings.add(AuditFinding.note(label, "option model = " + model.optionModel()));
        }
        checkTenantModel(label, model.tenantModel(), findings);

        OptionModel optionModel = registry.optionModelFor(model).orElse(null);
        if (manager != null && optionModel != null) {
            try {
                long orphaned = manager.count(SelectionQuery.all().active().pointingToDeletedOptions(optionModel.table()));
                if (orphaned > 0) {
                    findings.add(AuditFinding.warning(label,
                            "%d active selection(s) point to deleted options; consider cleaning them up"
                                    .formatted(orphaned)));
                } else {
                    findings.add(AuditFinding.note(label, "no orphaned selections found"));
                }
            } catch (DataAccessException | TenantOptionsException e) {
                log.debug("Orphan check failed for {}", label, e);
                findings.add(AuditFinding.warning(label,
                        "could not check for orphaned selections: " + e.getMessage()));
            }
        }

        checkConstraints(label, model.constraints(), ConstraintNames.expectedForSelection(label), findings);
    }

    // ── Private Helpers ──

    private static void checkTenantModel(ModelLabel label, ModelLabel tenantModel, List<AuditFinding> findings) {
        if (tenantModel == null) {
            findings.add(AuditFinding.fatal(label, "tenant model not set"));
        } else {
            findings.add(AuditFinding.note(label, "tenant model = " + tenantModel));
        }
    }

    private static void checkConstraints(
            ModelLabel label, Set<String> declared, List<String> expected, List<AuditFinding> findings) {
        List<String> missing = expected.stream().filter(name -> !declared.contains(name)).toList();
        if (missing.isEmpty()) {
            findings.add(AuditFinding.note(label, "database constraints properly configured"));
        } else {
            findings.add(AuditFinding.warning(label, "missing constraints: " + String.join(", ", missing)));
        }
    }
}
