package com.tenantoptions.model;

/** A model was used where a model of the other kind (option vs. selection) is required. */
public class IncorrectModelException extends TenantOptionsException {

    public IncorrectModelException(String message) {
        super(message);
    }
}
