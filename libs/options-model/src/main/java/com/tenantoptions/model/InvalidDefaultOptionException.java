package com.tenantoptions.model;

/** A model's default-options table declares an entry that is not MANDATORY or OPTIONAL. */
public class InvalidDefaultOptionException extends TenantOptionsException {

    public InvalidDefaultOptionException(String modelLabel, DefaultOption option) {
        super(("Option defaults must be of type MANDATORY or OPTIONAL. "
                        + "%s declares option_type = %s for '%s'.")
                .formatted(modelLabel, option.optionType(), option.name()));
    }
}
