package com.tenantoptions.model;

import java.util.List;

/**
 * A business rule was violated: bad type/tenant pairing, a custom name shadowing a default, a
 * selection of a deleted or foreign option. Recoverable by the caller; the message says what to
 * change.
 */
public class OptionValidationException extends TenantOptionsException {

    private final List<String> errors;

    public OptionValidationException(String subject, List<String> errors) {
        super("Invalid %s: %s".formatted(subject, String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
