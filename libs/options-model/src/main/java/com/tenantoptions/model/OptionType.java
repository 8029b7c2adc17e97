package com.tenantoptions.model;

import java.util.Optional;

/**
 * The three kinds of option a catalog can hold.
 *
 * <p>The {@code code} is the value persisted in the {@code option_type} column.
 */
public enum OptionType {

    /** Selected for every tenant; tenants can see it but never deselect it. */
    MANDATORY("dm", "Default Mandatory"),

    /** Offered to every tenant; each tenant opts in through a selection. */
    OPTIONAL("do", "Default Optional"),

    /** Authored by a single tenant and only visible to that tenant. */
    CUSTOM("cu", "Custom");

    private final String code;
    private final String label;

    OptionType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    /** The persisted column value (e.g. "dm"). */
    public String code() {
        return code;
    }

    /** Human-readable label used by operator output. */
    public String label() {
        return label;
    }

    /** True for MANDATORY and OPTIONAL, the types a default-options table may declare. */
    public boolean isDefaultType() {
        return this != CUSTOM;
    }

    /**
     * Looks up an OptionType by its persisted code.
     *
     * @param code the column value (e.g. "cu")
     * @return the matching type, or empty if the code is unknown
     */
    public static Optional<OptionType> fromCode(String code) {
        for (OptionType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
