package com.tenantoptions.store;

import com.tenantoptions.model.OptionTrait;
import com.tenantoptions.model.OptionType;
import com.tenantoptions.model.ValidationResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Locale;

/**
 * Rules an option must satisfy before it is written.
 */
public final class OptionValidator {

    private OptionValidator() {
    }

    /**
     * Validates a candidate option.
     *
     * @param name the option name
     * @param type the option type
     * @param tenantId owning tenant, null for MANDATORY and OPTIONAL options
     * @param defaultNames names of the model's MANDATORY and OPTIONAL options, consulted for CUSTOM
     *        options only
     */
    public static ValidationResult validate(String name, OptionType type, Long tenantId,
                                            Collection<String> defaultNames) {
        var errors = new ArrayList<String>();
        if (name == null || name.isBlank()) {
            errors.add("name: must not be blank");
        } else if (name.length() > OptionTrait.MAX_NAME_LENGTH) {
            errors.add("name: must be at most %d characters".formatted(OptionTrait.MAX_NAME_LENGTH));
        }
        if (type == null) {
            errors.add("option_type: must be set");
            return ValidationResult.fail(errors);
        }
        if (type == OptionType.CUSTOM && tenantId == null) {
            errors.add("tenant: custom options must belong to a tenant");
        }
        if (type != OptionType.CUSTOM && tenantId != null) {
            errors.add("tenant: %s options must not belong to a tenant".formatted(type.label()));
        }
        if (type == OptionType.CUSTOM && name != null && shadowsDefault(name, defaultNames)) {
            errors.add("name: a custom option cannot have the same name as a mandatory or optional option");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean shadowsDefault(String name, Collection<String> defaultNames) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return defaultNames.stream().anyMatch(n -> n.toLowerCase(Locale.ROOT).equals(lowered));
    }
}
