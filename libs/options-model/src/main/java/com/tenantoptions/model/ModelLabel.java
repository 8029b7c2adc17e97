package com.tenantoptions.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reference to a model in {@code app_label.ModelName} form.
 *
 * @param app the application label (e.g. "tasks")
 * @param name the model name (e.g. "TaskPriority")
 */
public record ModelLabel(String app, String name) {

    private static final Pattern PART = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ModelLabel {
        if (app == null || !PART.matcher(app).matches()) {
            throw new ModelLabelException(app + "." + name);
        }
        if (name == null || !PART.matcher(name).matches()) {
            throw new ModelLabelException(app + "." + name);
        }
    }

    /**
     * Parses a label of the form {@code app.Model}.
     *
     * @throws ModelLabelException if the label is null or malformed
     */
    public static ModelLabel parse(String label) {
        if (label == null) {
            throw new ModelLabelException("null");
        }
        String[] parts = label.trim().split("\\.");
        if (parts.length != 2) {
            throw new ModelLabelException(label);
        }
        return new ModelLabel(parts[0], parts[1]);
    }

    /** Lower-cased model name, as used in constraint names and migration file names. */
    public String modelName() {
        return name.toLowerCase(Locale.ROOT);
    }

    /** Conventional table name: {@code app_model}, lower-cased. */
    public String defaultTable() {
        return (app + "_" + name).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return app + "." + name;
    }
}
