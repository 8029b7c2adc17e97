package com.tenantoptions.store.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the options catalog.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * tenant-options:
 *   tenant-model: tenants.Tenant
 *   db-vendor-override: postgresql
 *   allow-deleted-option-selection: false
 *   models:
 *     - option: tasks.TaskPriority
 *       selection: tasks.TaskPrioritySelection
 *       default-options:
 *         Critical: {option-type: MANDATORY}
 *         High: {option-type: OPTIONAL}
 * }</pre>
 *
 * <p>Option names containing characters other than letters, digits, {@code -} and {@code .} must
 * be bracketed as map keys ({@code "[Very High]"}).
 *
 * @param dbVendorOverride vendor to generate SQL for instead of the connected database's
 * @param allowDeletedOptionSelection whether tenants may select soft-deleted options
 * @param tenantModel label of the host's tenant model, used when a model sets none
 * @param tenantTable tenant table, defaults to the tenant model's conventional table
 * @param models the option/selection model pairs
 */
@Validated
@ConfigurationProperties(prefix = "tenant-options")
public record TenantOptionsProperties(
        String dbVendorOverride,
        boolean allowDeletedOptionSelection,
        @NotBlank String tenantModel,
        String tenantTable,
        @Valid List<ModelProperties> models) {

    public TenantOptionsProperties {
        if (tenantModel == null) {
            tenantModel = "tenants.Tenant";
        }
        if (models == null) {
            models = List.of();
        }
    }

    /**
     * One option model and the selection model paired with it.
     *
     * @param option option model label ({@code app.Model})
     * @param table option table, defaults to {@code app_model}
     * @param selection selection model label; omit to register the option model alone
     * @param selectionTable selection table, defaults to {@code app_model}
     * @param tenantModel overrides the global tenant model for this pair
     * @param tenantTable overrides the global tenant table for this pair
     * @param defaultOptions option name to declaration, in declaration order
     * @param constraints option constraint names; omit to declare every expected one
     * @param selectionConstraints selection constraint names; omit to declare every expected one
     */
    public record ModelProperties(
            @NotBlank String option,
            String table,
            String selection,
            String selectionTable,
            String tenantModel,
            String tenantTable,
            Map<String, DefaultOptionProperties> defaultOptions,
            List<String> constraints,
            List<String> selectionConstraints) {

        public ModelProperties {
            defaultOptions = defaultOptions == null ? Map.of() : new LinkedHashMap<>(defaultOptions);
        }
    }

    /**
     * Declaration of one default option.
     *
     * @param optionType MANDATORY, OPTIONAL (or their codes); omitted means MANDATORY
     */
    public record DefaultOptionProperties(String optionType) {}
}
