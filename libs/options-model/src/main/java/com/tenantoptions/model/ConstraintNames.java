package com.tenantoptions.model;

import java.util.List;

/**
 * Naming templates for the constraints every option and selection table declares.
 * {@code {app}} and {@code {model}} expand to the app label and the lower-cased model name.
 */
public final class ConstraintNames {

    public static final String UNIQUE_NAME = "{app}_{model}_unique_name";
    public static final String TENANT_CHECK = "{app}_{model}_tenant_check";
    public static final String OPTION_NOT_NULL = "{app}_{model}_option_not_null";
    public static final String TENANT_NOT_NULL = "{app}_{model}_tenant_not_null";
    public static final String UNIQUE_ACTIVE_SELECTION = "{app}_{model}_unique_active_selection";

    private ConstraintNames() {
    }

    public static String resolve(String template, ModelLabel label) {
        return template.replace("{app}", label.app()).replace("{model}", label.modelName());
    }

    /** Constraints an option table is expected to carry. */
    public static List<String> expectedForOption(ModelLabel label) {
        return List.of(resolve(UNIQUE_NAME, label), resolve(TENANT_CHECK, label));
    }

    /** Constraints a selection table is expected to carry. */
    public static List<String> expectedForSelection(ModelLabel label) {
        return List.of(
                resolve(OPTION_NOT_NULL, label),
                resolve(TENANT_NOT_NULL, label),
                resolve(UNIQUE_ACTIVE_SELECTION, label));
    }
}
