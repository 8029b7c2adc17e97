package com.tenantoptions.model;

/**
 * One entry of a model's static default-options table.
 *
 * <p>The type is kept as declared, even when invalid, so that sync can refuse it and the auditor
 * can report it.
 *
 * @param name option name
 * @param optionType declared type; a null type means MANDATORY
 */
public record DefaultOption(String name, OptionType optionType) {

    public DefaultOption {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("default option name must not be null or blank");
        }
        if (optionType == null) {
            optionType = OptionType.MANDATORY;
        }
    }

    public static DefaultOption mandatory(String name) {
        return new DefaultOption(name, OptionType.MANDATORY);
    }

    public static DefaultOption optional(String name) {
        return new DefaultOption(name, OptionType.OPTIONAL);
    }
}
