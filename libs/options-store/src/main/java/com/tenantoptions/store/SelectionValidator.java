package com.tenantoptions.store;

import com.tenantoptions.model.Option;
import com.tenantoptions.model.ValidationResult;
import java.util.ArrayList;
import java.util.function.LongSupplier;

/**
 * Rules a selection must satisfy before it is written.
 */
public final class SelectionValidator {

    private SelectionValidator() {
    }

    /**
     * Validates a candidate selection.
     *
     * @param tenantId the selecting tenant
     * @param optionId the requested option id
     * @param option the option row, or null if no row has that id
     * @param policy lifecycle switches
     * @param activeAlternatives counts the options the tenant could select instead; only called
     *        when the option turns out to be deleted
     */
    public static ValidationResult validate(Long tenantId, Long optionId, Option option,
                                            LifecyclePolicy policy, LongSupplier activeAlternatives) {
        var errors = new ArrayList<String>();
        if (tenantId == null) {
            errors.add("tenant: must be set");
        }
        if (optionId == null) {
            errors.add("option: must be set");
        } else if (option == null) {
            errors.add("option: no option with id %d exists".formatted(optionId));
        }
        if (!errors.isEmpty()) {
            return ValidationResult.fail(errors);
        }
        if (!option.isActive() && !policy.allowDeletedOptionSelection()) {
            errors.add("option: '%s' has been deleted; choose one of the %d active options instead"
                    .formatted(option.name(), activeAlternatives.getAsLong()));
        }
        if (option.tenantId() != null && !option.tenantId().equals(tenantId)) {
            errors.add("option: the custom option '%s' belongs to tenant %d and is not available to tenant %d"
                    .formatted(option.name(), option.tenantId(), tenantId));
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
