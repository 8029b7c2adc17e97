package com.tenantoptions.model;

/** A model reference could not be parsed as {@code app.ModelName}. */
public class ModelLabelException extends TenantOptionsException {

    public ModelLabelException(String label) {
        super("Model reference '%s' must have the form app_label.ModelName".formatted(label));
    }
}
