package com.tenantoptions.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of validating an option or selection before a write.
 *
 * @param valid true if validation passed with no errors
 * @param errors human-readable error messages, each prefixed with the offending field
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Convenience factory for a failed validation with one message. */
    public static ValidationResult fail(String error) {
        return fail(List.of(error));
    }

    /** Combines two results, keeping every error of both. */
    public ValidationResult and(ValidationResult other) {
        if (valid && other.valid) {
            return ok();
        }
        var merged = new ArrayList<String>(errors);
        merged.addAll(other.errors);
        return fail(merged);
    }

    /**
     * Throws an {@link OptionValidationException} carrying every error if this result failed.
     *
     * @param subject what was being validated, used in the exception message
     */
    public void orThrow(String subject) {
        if (!valid) {
            throw new OptionValidationException(subject, errors);
        }
    }
}
